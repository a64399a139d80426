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
public class BackfillResultDTO {
    private Long shiftId;
    private LocalDateTime cutoff;
    private Integer linkedEntries;
}
