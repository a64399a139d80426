package com.bmsedge.parking.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * fee = billableDays x resolved daily rate. No side effects; callers persist.
 */
@Component
public class FeeCalculator {

    public FeeCalculation calculate(RateTable rateTable, String vehicleType, int billableDays) {
        if (billableDays < 1) {
            throw new IllegalArgumentException("Billable days must be at least 1, got " + billableDays);
        }
        RateTable.Resolution resolution = rateTable.resolve(vehicleType);
        BigDecimal fee = resolution.getDailyRate()
                .multiply(BigDecimal.valueOf(billableDays))
                .setScale(2, RoundingMode.HALF_UP);
        return new FeeCalculation(resolution.getVehicleType(), resolution.getDailyRate(),
                billableDays, fee, resolution.isFallback());
    }

    @Getter
    @AllArgsConstructor
    public static final class FeeCalculation {
        private final String resolvedVehicleType;
        private final BigDecimal dailyRate;
        private final int billableDays;
        private final BigDecimal fee;
        private final boolean usedFallbackRate;
    }
}
