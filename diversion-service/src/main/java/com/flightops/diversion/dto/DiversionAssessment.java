package com.flightops.diversion.dto;

import com.flightops.diversion.enums.DataProvenance;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete advisory output for one flight and one candidate diversion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiversionAssessment {

    FeasibilityResult feasibility;
    CrewLegalityCheck crewLegality;
    DiversionResult diversionResult;
    CostEstimate costEstimate;
    CustomerImpactScore customerImpact;
    FuelDecisionAnalysis fuelAnalysis;
    WeatherReport weather;

    @Builder.Default
    List<Notam> notams = new ArrayList<>();

    /** Absent when no feed data could be obtained. */
    DataProvenance feedProvenance;

    String incidentReport;
    String executiveSummary;
    String jsonReport;
}
