package com.bmsedge.parking.exception;

import lombok.Getter;

import java.time.LocalDateTime;

@Getter
public class InvalidIntervalException extends ParkingEngineException {

    private final LocalDateTime entryTime;
    private final LocalDateTime exitTime;

    public InvalidIntervalException(LocalDateTime entryTime, LocalDateTime exitTime) {
        super("InvalidInterval", "Exit time " + exitTime + " is before entry time " + entryTime);
        this.entryTime = entryTime;
        this.exitTime = exitTime;
    }
}
