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
public class FeeCorrectionRequest {
    private BigDecimal fee;
    private String reason;
    private String correctedBy;
}
