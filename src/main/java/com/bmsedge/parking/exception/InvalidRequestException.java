package com.bmsedge.parking.exception;

public class InvalidRequestException extends ParkingEngineException {

    public InvalidRequestException(String message) {
        super("InvalidRequest", message);
    }
}
