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
public class HandoverRequest {
    private BigDecimal closingCash;      // carried forward as the next opening cash
    private String handoverNotes;
    private String pendingIssues;
    private String incomingEmployeeId;
    private String incomingEmployeeName;
    private String supervisorId;
    private Boolean acknowledgeDiscrepancy;
}
