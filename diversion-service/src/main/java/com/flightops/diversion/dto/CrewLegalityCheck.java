package com.flightops.diversion.dto;

import com.flightops.diversion.enums.ExtensionType;
import com.flightops.diversion.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrewLegalityCheck {

    boolean legal;
    int timeRemaining;
    int requiredTime;
    int safetyMargin;

    @Builder.Default
    List<String> recommendations = new ArrayList<>();

    RiskLevel riskLevel;

    /** Absent when the scenario needs no extension. */
    ExtensionType extensionType;
}
