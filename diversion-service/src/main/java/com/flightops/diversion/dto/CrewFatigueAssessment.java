package com.flightops.diversion.dto;

import com.flightops.diversion.enums.FatigueLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory fatigue grading. Never blocks an operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrewFatigueAssessment {

    FatigueLevel fatigueLevel;
    double dutyHours;

    @Builder.Default
    List<String> indicators = new ArrayList<>();

    @Builder.Default
    List<String> recommendations = new ArrayList<>();
}
