package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FuelMonitorStatus {
    NORMAL("normal", "Normal operations - no action required"),
    MONITOR("monitor", "Continue monitoring - consider fuel-saving procedures"),
    CAUTION("caution", "Request direct routing and monitor consumption closely"),
    CRITICAL("critical", "Consider immediate diversion to nearest suitable airport");

    @JsonValue
    private final String code;
    private final String recommendedAction;
}
