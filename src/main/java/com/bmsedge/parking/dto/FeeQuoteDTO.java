package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeQuoteDTO {
    private String vehicleType;          // as supplied
    private String resolvedVehicleType;  // rate-table type, or null on fallback
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private Integer billableDays;
    private BigDecimal dailyRate;
    private BigDecimal overstayPenalty;
    private BigDecimal fee;
    private Boolean usedFallbackRate;
}
