package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleEntryRequest {
    private String vehicleNumber;
    private String vehicleType;
    private LocalDateTime entryTime;     // defaults to now
    private String paymentMethod;        // cash, upi, card, ...
}
