package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Four-step risk grade shared by every risk axis, ordered from least to most severe.
 */
@Getter
@RequiredArgsConstructor
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    @JsonValue
    private final String code;

    /**
     * One step more severe; CRITICAL stays CRITICAL.
     */
    public RiskLevel escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public static RiskLevel worstOf(RiskLevel... levels) {
        RiskLevel worst = LOW;
        for (RiskLevel level : levels) {
            if (level != null && level.compareTo(worst) > 0) {
                worst = level;
            }
        }
        return worst;
    }
}
