package com.bmsedge.parking.model;

public enum ShiftCloseType {
    NORMAL,
    HANDOVER,
    EMERGENCY
}
