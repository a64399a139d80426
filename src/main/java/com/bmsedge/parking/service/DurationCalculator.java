package com.bmsedge.parking.service;

import com.bmsedge.parking.exception.InvalidIntervalException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Converts a stay into billable days. Any part of a day bills as a full
 * day and every stay bills at least one day.
 */
@Component
@RequiredArgsConstructor
public class DurationCalculator {

    private final Clock clock;

    public int billableDays(LocalDateTime entryTime, LocalDateTime exitTime) {
        Duration elapsed = elapsed(entryTime, exitTime);
        long days = elapsed.toDays();
        if (!elapsed.minusDays(days).isZero()) {
            days++;
        }
        return (int) Math.max(1, days);
    }

    /** Preview against the current time for a vehicle still parked. */
    public int billableDaysUntilNow(LocalDateTime entryTime) {
        return billableDays(entryTime, now());
    }

    public Duration elapsed(LocalDateTime entryTime, LocalDateTime exitTime) {
        if (entryTime == null || exitTime == null || exitTime.isBefore(entryTime)) {
            throw new InvalidIntervalException(entryTime, exitTime);
        }
        return Duration.between(entryTime, exitTime);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
