package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NotamType {
    RUNWAY("runway"),
    TAXIWAY("taxiway"),
    EQUIPMENT("equipment"),
    AIRSPACE("airspace"),
    PROCEDURE("procedure");

    @JsonValue
    private final String code;
}
