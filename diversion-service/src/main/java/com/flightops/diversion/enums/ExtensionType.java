package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Duty extension class needed to absorb a scenario, bounded by {@code maxMinutes}.
 */
@Getter
@RequiredArgsConstructor
public enum ExtensionType {
    COMMANDER("Commander discretionary", 60),
    DISCRETIONARY("Discretionary extension", 120),
    OPERATIONAL("Operational extension (requires approval)", 180),
    NOT_PERMITTED("Not permitted", Integer.MAX_VALUE);

    @JsonValue
    private final String description;
    private final int maxMinutes;

    public static ExtensionType forExtension(int extensionMinutes) {
        for (ExtensionType type : values()) {
            if (extensionMinutes <= type.maxMinutes) {
                return type;
            }
        }
        return NOT_PERMITTED;
    }
}
