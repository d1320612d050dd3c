package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FacilitiesRating {
    EXCELLENT("excellent"),
    GOOD("good"),
    BASIC("basic"),
    LIMITED("limited");

    @JsonValue
    private final String code;
}
