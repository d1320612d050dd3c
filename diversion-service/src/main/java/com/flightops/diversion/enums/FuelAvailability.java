package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FuelAvailability {
    EXCELLENT("excellent"),
    GOOD("good"),
    LIMITED("limited"),
    UNAVAILABLE("unavailable");

    @JsonValue
    private final String code;
}
