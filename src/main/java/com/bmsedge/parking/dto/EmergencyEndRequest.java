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
public class EmergencyEndRequest {
    private String reason;
    private String supervisorId;
    private BigDecimal closingCash;      // optional
}
