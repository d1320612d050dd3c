package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CustomerImpactCategory {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    SEVERE("severe");

    @JsonValue
    private final String code;
}
