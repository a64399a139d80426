package com.bmsedge.parking.exception;

import com.bmsedge.parking.dto.DiscrepancyDTO;
import lombok.Getter;

@Getter
public class DiscrepancyAcknowledgementRequiredException extends ParkingEngineException {

    private final DiscrepancyDTO discrepancy;

    public DiscrepancyAcknowledgementRequiredException(DiscrepancyDTO discrepancy) {
        super("DiscrepancyAcknowledgementRequired", "Cash discrepancy of " + discrepancy.getDelta()
                + " on shift " + discrepancy.getShiftId()
                + " exceeds the major threshold; acknowledge it with a note to close the shift");
        this.discrepancy = discrepancy;
    }
}
