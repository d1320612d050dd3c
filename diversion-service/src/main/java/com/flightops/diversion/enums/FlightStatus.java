package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Operational status of a flight. Arrived and Cancelled are terminal.
 */
@Getter
@RequiredArgsConstructor
public enum FlightStatus {
    SCHEDULED("Scheduled"),
    DEPARTED("Departed"),
    EN_ROUTE("En Route"),
    DELAYED("Delayed"),
    DIVERTED("Diverted"),
    ARRIVED("Arrived"),
    CANCELLED("Cancelled");

    @JsonValue
    private final String label;

    public boolean isTerminal() {
        return this == ARRIVED || this == CANCELLED;
    }

    /**
     * Resolves a status by its label or constant name, ignoring case. Unknown values resolve to
     * {@link #SCHEDULED}.
     */
    public static FlightStatus fromLabel(String value) {
        if (value == null) {
            return SCHEDULED;
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(SCHEDULED);
    }
}
