package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum WeatherSuitability {
    EXCELLENT("excellent"),
    GOOD("good"),
    MARGINAL("marginal"),
    POOR("poor");

    @JsonValue
    private final String code;
}
