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
public class ShiftEventDTO {
    private String type;                 // SHIFT_OPENED, SHIFT_CLOSED, SHIFT_HANDOVER, SHIFT_EMERGENCY_END
    private Long shiftId;
    private String employeeId;
    private LocalDateTime timestamp;
}
