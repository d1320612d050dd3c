package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AlertType {
    WEATHER("weather"),
    NOTAM("notam"),
    FUEL("fuel"),
    OPERATIONAL("operational");

    @JsonValue
    private final String code;
}
