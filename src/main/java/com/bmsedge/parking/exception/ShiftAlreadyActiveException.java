package com.bmsedge.parking.exception;

import lombok.Getter;

@Getter
public class ShiftAlreadyActiveException extends ParkingEngineException {

    private final Long activeShiftId;

    public ShiftAlreadyActiveException(Long activeShiftId) {
        super("ShiftAlreadyActive", activeShiftId != null
                ? "Shift " + activeShiftId + " is already active"
                : "Another shift is already active");
        this.activeShiftId = activeShiftId;
    }
}
