package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Emergency category driving the diversion candidate catalog and insurance liability tables.
 */
@Getter
@RequiredArgsConstructor
public enum EmergencyType {
    MEDICAL("medical"),
    TECHNICAL("technical"),
    WEATHER("weather");

    @JsonValue
    private final String code;

    public static Optional<EmergencyType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst();
    }
}
