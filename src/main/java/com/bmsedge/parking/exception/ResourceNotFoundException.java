package com.bmsedge.parking.exception;

public class ResourceNotFoundException extends ParkingEngineException {

    public ResourceNotFoundException(String message) {
        super("NotFound", message);
    }
}
