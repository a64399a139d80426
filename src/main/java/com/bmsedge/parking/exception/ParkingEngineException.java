package com.bmsedge.parking.exception;

import lombok.Getter;

/**
 * Base type for engine failures. {@code code} is the stable taxonomy name
 * reported to API callers.
 */
@Getter
public abstract class ParkingEngineException extends RuntimeException {

    private final String code;

    protected ParkingEngineException(String code, String message) {
        super(message);
        this.code = code;
    }
}
