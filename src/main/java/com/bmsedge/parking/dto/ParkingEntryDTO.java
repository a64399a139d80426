package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.bmsedge.parking.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParkingEntryDTO {
    private Long id;
    private String vehicleNumber;
    private String vehicleType;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private BigDecimal fee;
    private Integer billableDays;
    private Boolean usedFallbackRate;
    private PaymentMethod paymentMethod;
    private Boolean paymentSettled;
    private Long shiftId;
    private BigDecimal assessedFee;
    private String correctionReason;
    private Boolean archived;
}
