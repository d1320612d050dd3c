package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IncidentSeverity {
    MINOR("minor", 0.10),
    MAJOR("major", 0.30),
    SERIOUS("serious", 0.60);

    @JsonValue
    private final String code;
    private final double claimRate;
}
