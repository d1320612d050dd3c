package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Urgency {
    ROUTINE("routine"),
    URGENT("urgent"),
    EMERGENCY("emergency"),
    CRITICAL("critical");

    @JsonValue
    private final String code;
}
