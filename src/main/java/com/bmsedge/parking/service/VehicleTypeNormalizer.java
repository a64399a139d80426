package com.bmsedge.parking.service;

import java.util.Locale;
import java.util.Map;

/**
 * Folds the many spellings of a vehicle type seen at the gate
 * ("2-Wheeler", "2wheeler", " 2 wheeler ") into one lookup key.
 */
public final class VehicleTypeNormalizer {

    // Keys are already normalized
    private static final Map<String, String> ALIASES = Map.of(
            "twowheeler", "2wheeler",
            "bike", "2wheeler",
            "motorcycle", "2wheeler",
            "fourwheeler", "4wheeler",
            "sixwheeler", "6wheeler"
    );

    private VehicleTypeNormalizer() {
    }

    public static String normalize(String rawVehicleType) {
        if (rawVehicleType == null) {
            return "";
        }
        String key = rawVehicleType.toLowerCase(Locale.ROOT).replaceAll("[^\\p{Alnum}]", "");
        return ALIASES.getOrDefault(key, key);
    }
}
