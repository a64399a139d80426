package com.bmsedge.parking.service;

import com.bmsedge.parking.dto.FeeQuoteDTO;
import com.bmsedge.parking.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingFeeService {

    private final RateTableService rateTableService;
    private final DurationCalculator durationCalculator;
    private final FeeCalculator feeCalculator;
    private final OverstayPenaltyPolicy overstayPenaltyPolicy;

    /**
     * Prices a stay. A missing exit time quotes against the current time.
     */
    public FeeQuoteDTO computeFee(String vehicleType, LocalDateTime entryTime, LocalDateTime exitTime) {
        return computeFee(rateTableService.load(), vehicleType, entryTime, exitTime);
    }

    public FeeQuoteDTO computeFee(RateTable rateTable, String vehicleType,
                                  LocalDateTime entryTime, LocalDateTime exitTime) {
        if (vehicleType == null || vehicleType.isBlank()) {
            throw new InvalidRequestException("Vehicle type is required");
        }
        LocalDateTime effectiveExit = exitTime != null ? exitTime : durationCalculator.now();
        Duration stay = durationCalculator.elapsed(entryTime, effectiveExit);
        int days = durationCalculator.billableDays(entryTime, effectiveExit);

        FeeCalculator.FeeCalculation calc = feeCalculator.calculate(rateTable, vehicleType, days);
        if (calc.isUsedFallbackRate()) {
            log.warn("No rate configured for vehicle type '{}', using default rate {}", vehicleType, calc.getDailyRate());
        }

        BigDecimal penalty = overstayPenaltyPolicy.penaltyFor(vehicleType, stay, days, calc.getDailyRate());
        if (penalty == null) {
            penalty = BigDecimal.ZERO;
        }
        BigDecimal fee = calc.getFee().add(penalty).setScale(2, RoundingMode.HALF_UP);

        return FeeQuoteDTO.builder()
                .vehicleType(vehicleType)
                .resolvedVehicleType(calc.getResolvedVehicleType())
                .entryTime(entryTime)
                .exitTime(effectiveExit)
                .billableDays(days)
                .dailyRate(calc.getDailyRate())
                .overstayPenalty(penalty.setScale(2, RoundingMode.HALF_UP))
                .fee(fee)
                .usedFallbackRate(calc.isUsedFallbackRate())
                .build();
    }
}
