package com.bmsedge.parking.service;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Extension point for late or overstay surcharges added on top of the
 * daily fee. The default adds nothing.
 */
public interface OverstayPenaltyPolicy {

    OverstayPenaltyPolicy NONE = (vehicleType, stay, billableDays, dailyRate) -> BigDecimal.ZERO;

    BigDecimal penaltyFor(String vehicleType, Duration stay, int billableDays, BigDecimal dailyRate);
}
