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
public class VehicleExitRequest {
    private LocalDateTime exitTime;      // defaults to now
    private String paymentMethod;        // overrides the method captured at entry
    private Boolean paymentSettled;      // defaults to true
}
