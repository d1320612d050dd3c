package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the report generator needs about one diversion. Weather and NOTAMs are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IncidentReportData {

    FlightStateEntry flight;
    DiversionResult diversionResult;
    CostEstimate costEstimate;
    CustomerImpactScore customerImpact;
    CrewLegalityCheck crewStatus;
    FuelDecisionAnalysis fuelAnalysis;
    WeatherReport weather;

    @Builder.Default
    List<Notam> notams = new ArrayList<>();
}
