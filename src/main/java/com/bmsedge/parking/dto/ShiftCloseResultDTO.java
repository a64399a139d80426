package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftCloseResultDTO {
    private ShiftSessionDTO shift;
    private ShiftStatisticsDTO statistics;
    private DiscrepancyDTO discrepancy;
}
