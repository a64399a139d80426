package com.bmsedge.parking.service;

import com.bmsedge.parking.model.VehicleRate;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the daily rates, loaded once per engine call.
 */
public final class RateTable {

    private final Map<String, Resolution> ratesByKey;
    @Getter
    private final BigDecimal defaultRate;

    private RateTable(Map<String, Resolution> ratesByKey, BigDecimal defaultRate) {
        this.ratesByKey = Collections.unmodifiableMap(ratesByKey);
        this.defaultRate = defaultRate;
    }

    public static RateTable of(List<VehicleRate> rates, BigDecimal defaultRate) {
        if (defaultRate == null || defaultRate.signum() < 0) {
            throw new IllegalArgumentException("A non-negative default rate is required");
        }
        Map<String, Resolution> byKey = new LinkedHashMap<>();
        for (VehicleRate rate : rates) {
            String key = VehicleTypeNormalizer.normalize(rate.getVehicleType());
            if (byKey.putIfAbsent(key, new Resolution(rate.getVehicleType(), rate.getDailyRate(), false)) != null) {
                throw new IllegalArgumentException("Duplicate vehicle type in rate table: " + rate.getVehicleType());
            }
        }
        return new RateTable(byKey, defaultRate);
    }

    public static RateTable of(Map<String, BigDecimal> rates, BigDecimal defaultRate) {
        List<VehicleRate> rows = rates.entrySet().stream()
                .map(e -> VehicleRate.builder().vehicleType(e.getKey()).dailyRate(e.getValue()).build())
                .collect(Collectors.toList());
        return of(rows, defaultRate);
    }

    /**
     * Resolves a raw vehicle type, falling back to the default rate when
     * nothing matches.
     */
    public Resolution resolve(String rawVehicleType) {
        Resolution match = ratesByKey.get(VehicleTypeNormalizer.normalize(rawVehicleType));
        return match != null ? match : new Resolution(null, defaultRate, true);
    }

    public int size() {
        return ratesByKey.size();
    }

    @Getter
    @AllArgsConstructor
    public static final class Resolution {
        private final String vehicleType;   // null when the default rate applied
        private final BigDecimal dailyRate;
        private final boolean fallback;
    }
}
