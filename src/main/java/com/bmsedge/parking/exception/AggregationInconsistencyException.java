package com.bmsedge.parking.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Statistics recorded for a shift no longer match a fresh recomputation
 * from its entries. Indicates a write path that skipped recompute.
 */
@Getter
public class AggregationInconsistencyException extends ParkingEngineException {

    private final Long shiftId;
    private final BigDecimal recorded;
    private final BigDecimal recomputed;

    public AggregationInconsistencyException(Long shiftId, String field, BigDecimal recorded, BigDecimal recomputed) {
        super("AggregationInconsistency", "Shift " + shiftId + " " + field + " recorded=" + recorded
                + " recomputed=" + recomputed);
        this.shiftId = shiftId;
        this.recorded = recorded;
        this.recomputed = recomputed;
    }
}
