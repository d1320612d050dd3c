package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FatigueLevel {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    @JsonValue
    private final String code;

    public FatigueLevel escalate() {
        return this == LOW ? MODERATE : HIGH;
    }
}
