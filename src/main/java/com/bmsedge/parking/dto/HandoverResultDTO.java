package com.bmsedge.parking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandoverResultDTO {
    private ShiftCloseResultDTO previousShift;
    private ShiftSessionDTO newShift;
    private Long changeId;
    private LocalDateTime handoverTimestamp;
}
