package com.bmsedge.parking.model;

public enum ShiftStatus {
    ACTIVE,
    COMPLETED
}
