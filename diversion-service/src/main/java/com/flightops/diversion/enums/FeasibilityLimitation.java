package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons a diversion scenario is constrained. Advisory limitations annotate a
 * scenario without making it infeasible.
 */
@Getter
@RequiredArgsConstructor
public enum FeasibilityLimitation {
    INSUFFICIENT_FUEL("Insufficient fuel for diversion", true),
    CREW_DUTY_EXCEEDED("Crew duty time limitations", true),
    POST_DIVERSION_FUEL_CRITICAL("Post-diversion fuel state critical", false),
    POST_DIVERSION_CREW_LOW("Crew approaching maximum duty time", false);

    @JsonValue
    private final String message;
    private final boolean blocking;
}
