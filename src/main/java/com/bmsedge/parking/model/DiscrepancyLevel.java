package com.bmsedge.parking.model;

public enum DiscrepancyLevel {
    BALANCED,   // within the minor threshold
    MINOR,      // warn only
    MAJOR       // needs acknowledgement and a note before close
}
