package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.bmsedge.parking.model.DiscrepancyLevel;
import com.bmsedge.parking.model.ShiftCloseType;
import com.bmsedge.parking.model.ShiftStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftSessionDTO {
    private Long id;
    private String employeeId;
    private String employeeName;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private BigDecimal openingCash;
    private BigDecimal closingCash;
    private ShiftStatus status;
    private ShiftCloseType closeType;
    private BigDecimal expectedClosingCash;
    private BigDecimal cashDiscrepancy;
    private DiscrepancyLevel discrepancyLevel;
    private Boolean discrepancyAcknowledged;
    private String shiftNotes;
    private String closingNotes;
    private String supervisorId;
}
