package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.bmsedge.parking.model.DiscrepancyLevel;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscrepancyDTO {
    private Long shiftId;
    private BigDecimal openingCash;
    private BigDecimal cashRevenue;
    private BigDecimal expectedClosingCash;
    private BigDecimal actualClosingCash;
    private BigDecimal delta;            // actual - expected, negative is a shortage
    private DiscrepancyLevel level;
    private Boolean requiresAcknowledgement;
}
