package com.flightops.diversion.dto;

import com.flightops.diversion.enums.FlightStatus;
import com.flightops.diversion.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Outcome of applying a diversion scenario to a flight. Owned by the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiversionResult {

    LocalDateTime originalEta;
    LocalDateTime newEta;
    String diversionAirport;
    int fuelRemaining;
    int crewTimeRemaining;
    FlightStatus status;
    String diversionReason;

    /** Minutes past the original ETA, never negative. */
    int totalDelay;

    AdditionalCosts additionalCosts;
    OperationalImpact operationalImpact;
    RiskAssessment riskAssessment;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AdditionalCosts {

        BigDecimal fuel;
        BigDecimal handling;
        BigDecimal passenger;
        BigDecimal crew;
        BigDecimal total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OperationalImpact {

        int downstreamFlights;
        boolean slotLoss;

        /** Minutes. */
        int recoveryTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RiskAssessment {

        RiskLevel fuel;
        RiskLevel crew;
        RiskLevel operational;
        RiskLevel overall;
    }
}
