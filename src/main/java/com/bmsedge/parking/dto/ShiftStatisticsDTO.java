package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftStatisticsDTO {
    private Long shiftId;
    private Integer vehiclesEntered;
    private Integer vehiclesExited;
    private Integer currentlyParked;
    private BigDecimal revenueTotal;
    private BigDecimal cashRevenue;
    private BigDecimal digitalRevenue;
    private Integer settledTransactions;
    private BigDecimal pendingSettlementAmount;   // exited with a fee, not yet settled
    private BigDecimal averageTransaction;
    private Double averageDurationMinutes;
    private List<VehicleTypeBreakdownDTO> vehicleTypes;
    private LocalDateTime computedAt;
}
