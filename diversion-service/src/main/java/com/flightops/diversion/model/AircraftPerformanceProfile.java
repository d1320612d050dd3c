package com.flightops.diversion.model;

import com.flightops.diversion.util.StringUtils;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-type performance numbers shared by every calculator that needs them.
 *
 * <p>Lookup is by normalised type: an exact match wins, then a family prefix match
 * ({@code B787-9} resolves to {@code B787}), then the default profile.
 */
@Value
@Builder
public class AircraftPerformanceProfile {

    public static final String DEFAULT_TYPE = "DEFAULT";

    private static final Map<String, AircraftPerformanceProfile> KNOWN_TYPES = new LinkedHashMap<>();

    static {
        register("B787", 6_800, 4.2, 15_000);
        register("A350", 6_500, 4.0, 18_000);
        register("A330", 7_200, 4.8, 16_000);
        register("B777", 8_500, 5.5, 20_000);
        register("A340", 9_200, 6.2, 22_000);
    }

    String aircraftType;

    /** Cruise burn in kg per hour. */
    int hourlyBurnKg;

    /** Planning burn in kg per km. */
    double burnPerKm;

    /** Fuel on board at or below which the flight is fuel-critical. */
    int fuelCriticalThresholdKg;

    public double burnPerMinute() {
        return hourlyBurnKg / 60.0;
    }

    public boolean isDefault() {
        return DEFAULT_TYPE.equals(aircraftType);
    }

    public static AircraftPerformanceProfile forType(String aircraftType) {
        String normalized = StringUtils.normalizeCode(aircraftType);
        if (normalized == null) {
            return fallback();
        }

        AircraftPerformanceProfile exact = KNOWN_TYPES.get(normalized);
        if (exact != null) {
            return exact;
        }
        return KNOWN_TYPES.entrySet().stream()
                .filter(entry -> normalized.startsWith(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(AircraftPerformanceProfile::fallback);
    }

    public static AircraftPerformanceProfile fallback() {
        return AircraftPerformanceProfile.builder()
                .aircraftType(DEFAULT_TYPE)
                .hourlyBurnKg(7_000)
                .burnPerKm(4.5)
                .fuelCriticalThresholdKg(15_000)
                .build();
    }

    private static void register(String type, int hourlyBurnKg, double burnPerKm, int fuelCriticalThresholdKg) {
        KNOWN_TYPES.put(type, AircraftPerformanceProfile.builder()
                .aircraftType(type)
                .hourlyBurnKg(hourlyBurnKg)
                .burnPerKm(burnPerKm)
                .fuelCriticalThresholdKg(fuelCriticalThresholdKg)
                .build());
    }
}
