package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloseShiftRequest {
    private BigDecimal closingCash;
    private String notes;
    private Boolean acknowledgeDiscrepancy;
}
