package com.bmsedge.parking.exception;

public class FeeAlreadyAssessedException extends ParkingEngineException {

    public FeeAlreadyAssessedException(String message) {
        super("FeeAlreadyAssessed", message);
    }
}
