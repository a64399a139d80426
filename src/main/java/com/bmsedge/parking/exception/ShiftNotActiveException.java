package com.bmsedge.parking.exception;

public class ShiftNotActiveException extends ParkingEngineException {

    public ShiftNotActiveException(String message) {
        super("ShiftNotActive", message);
    }
}
