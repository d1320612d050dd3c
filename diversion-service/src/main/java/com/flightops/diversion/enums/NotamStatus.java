package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NotamStatus {
    ACTIVE("active"),
    CANCELLED("cancelled"),
    REPLACED("replaced");

    @JsonValue
    private final String code;
}
