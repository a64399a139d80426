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
public class VehicleTypeBreakdownDTO {
    private String vehicleType;
    private Integer entered;
    private Integer exited;
    private BigDecimal revenue;
}
