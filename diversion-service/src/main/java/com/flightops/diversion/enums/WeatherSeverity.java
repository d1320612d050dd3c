package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * En-route weather class used for fuel planning, with its burn multiplier.
 */
@Getter
@RequiredArgsConstructor
public enum WeatherSeverity {
    GOOD("good", 1.0),
    MODERATE("moderate", 1.15),
    POOR("poor", 1.35);

    @JsonValue
    private final String code;
    private final double fuelMultiplier;

    /**
     * Unrecognised codes are planned as good weather.
     */
    public static WeatherSeverity fromCode(String code) {
        if (code == null) {
            return GOOD;
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(severity -> severity.code.equals(normalized))
                .findFirst()
                .orElse(GOOD);
    }
}
