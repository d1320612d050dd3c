package com.flightops.diversion.service;

import com.flightops.diversion.constants.ValidationMessages;
import com.flightops.diversion.dto.DiversionResult;
import com.flightops.diversion.dto.FeasibilityResult;
import com.flightops.diversion.enums.EmergencyType;
import com.flightops.diversion.enums.FeasibilityLimitation;
import com.flightops.diversion.enums.FlightStatus;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.enums.Urgency;
import com.flightops.diversion.enums.WeatherSuitability;
import com.flightops.diversion.exception.DiversionValidationException;
import com.flightops.diversion.model.DiversionScenario;
import com.flightops.diversion.model.FlightState;
import com.flightops.diversion.validator.DiversionInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.flightops.diversion.constants.DiversionConstants.CREW_APPROACHING_LIMIT_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_COMPENSATION_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_SLOT_LOSS_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DOWNSTREAM_FLIGHT_INTERVAL_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.DOWNSTREAM_HIGH_RISK;
import static com.flightops.diversion.constants.DiversionConstants.DOWNSTREAM_MEDIUM_RISK;
import static com.flightops.diversion.constants.DiversionConstants.EMERGENCY_RECOVERY_MULTIPLIER;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_RISK_CRITICAL_KG;

/**
 * Applies diversion scenarios to flights and proposes candidate diversions.
 *
 * <p>{@link #simulateDiversion} mutates the flight it is given. Callers own the flight and must not
 * run two simulations against the same instance concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScenarioEngineService {

    private final FuelAnalyticsService fuelAnalyticsService;
    private final CrewLegalityService crewLegalityService;
    private final CostModelService costModelService;
    private final DiversionScenarioCatalog scenarioCatalog;
    private final Clock clock;

    // ========== Simulation ==========

    public DiversionResult simulateDiversion(FlightState flight, DiversionScenario scenario) {
        DiversionInputValidator.validateDivertible(flight);
        DiversionInputValidator.validateScenario(scenario);

        LocalDateTime originalEta = flight.getEta();
        LocalDateTime newEta = LocalDateTime.now(clock).plusMinutes(scenario.getEstimatedFlightTime());
        int totalDelay = delayMinutes(originalEta, newEta);

        flight.updateEta(newEta);
        flight.updateFuelOnBoard(flight.getFuelOnBoard() - scenario.getExtraFuelBurn());
        flight.updateCrewDuty(flight.getCrewOnDuty() - scenario.getCrewTimeUsed());
        flight.updateStatus(FlightStatus.DIVERTED);

        DiversionResult.AdditionalCosts costs = costModelService.calculateScenarioCosts(
                scenario.getExtraFuelBurn(), totalDelay, scenario.getUrgency());
        DiversionResult.OperationalImpact impact = assessOperationalImpact(totalDelay, scenario.getUrgency());
        DiversionResult.RiskAssessment risk = assessRisk(flight, scenario, impact);

        DiversionResult result = DiversionResult.builder()
                .originalEta(originalEta)
                .newEta(newEta)
                .diversionAirport(scenario.getAirport())
                .fuelRemaining(flight.getFuelOnBoard())
                .crewTimeRemaining(flight.getCrewOnDuty())
                .status(flight.getStatus())
                .diversionReason(scenario.getReason())
                .totalDelay(totalDelay)
                .additionalCosts(costs)
                .operationalImpact(impact)
                .riskAssessment(risk)
                .build();

        log.info("Diversion simulated: flight={}, airport={}, delay={}min, overallRisk={}, totalCost={}",
                flight.getFlightNumber(), scenario.getAirport(), totalDelay, risk.getOverall(), costs.getTotal());
        return result;
    }

    /**
     * Whole minutes of delay, with any started minute counted so a delay just past a
     * threshold is graded past it.
     */
    private static int delayMinutes(LocalDateTime originalEta, LocalDateTime newEta) {
        if (originalEta == null) {
            return 0;
        }
        long millis = Duration.between(originalEta, newEta).toMillis();
        return (int) Math.max(0, Math.ceil(millis / 60_000.0));
    }

    private DiversionResult.OperationalImpact assessOperationalImpact(int delayMinutes, Urgency urgency) {
        int downstreamFlights = delayMinutes > DELAY_COMPENSATION_THRESHOLD
                ? (int) Math.ceil((double) delayMinutes / DOWNSTREAM_FLIGHT_INTERVAL_MINUTES)
                : 0;
        boolean emergency = urgency == Urgency.EMERGENCY;
        boolean slotLoss = delayMinutes > DELAY_SLOT_LOSS_THRESHOLD || emergency;
        int recoveryTime = (int) Math.round(emergency ? delayMinutes * EMERGENCY_RECOVERY_MULTIPLIER : delayMinutes);

        return DiversionResult.OperationalImpact.builder()
                .downstreamFlights(downstreamFlights)
                .slotLoss(slotLoss)
                .recoveryTime(recoveryTime)
                .build();
    }

    private DiversionResult.RiskAssessment assessRisk(FlightState flight, DiversionScenario scenario,
                                                      DiversionResult.OperationalImpact impact) {
        RiskLevel fuel = fuelAnalyticsService.assessRemainingFuelRisk(flight.getFuelOnBoard());
        RiskLevel crew = crewLegalityService.riskForRemainingMinutes(flight.getCrewOnDuty());
        RiskLevel operational = operationalRisk(impact.getDownstreamFlights(), scenario.getWeatherSuitability());

        return DiversionResult.RiskAssessment.builder()
                .fuel(fuel)
                .crew(crew)
                .operational(operational)
                .overall(RiskLevel.worstOf(fuel, crew, operational))
                .build();
    }

    /**
     * Graded on downstream knock-on, then one level worse when the diversion airport's weather is poor.
     */
    RiskLevel operationalRisk(int downstreamFlights, WeatherSuitability weather) {
        RiskLevel risk = RiskLevel.LOW;
        if (downstreamFlights > DOWNSTREAM_HIGH_RISK) {
            risk = RiskLevel.HIGH;
        } else if (downstreamFlights > DOWNSTREAM_MEDIUM_RISK) {
            risk = RiskLevel.MEDIUM;
        }
        return weather == WeatherSuitability.POOR ? risk.escalate() : risk;
    }

    // ========== Candidates ==========

    /**
     * Candidate diversions for the emergency that the flight can still fly and crew.
     * Unknown emergency types yield no candidates.
     */
    public List<DiversionScenario> generateDiversionScenarios(FlightState flight, String emergencyType) {
        DiversionInputValidator.validateFlight(flight);

        return EmergencyType.fromCode(emergencyType)
                .map(type -> generateDiversionScenarios(flight, type))
                .orElseGet(() -> {
                    log.debug("No diversion candidates for unknown emergency type: {}", emergencyType);
                    return List.of();
                });
    }

    public List<DiversionScenario> generateDiversionScenarios(FlightState flight, EmergencyType emergencyType) {
        DiversionInputValidator.validateFlight(flight);
        if (emergencyType == null) {
            throw new DiversionValidationException(ValidationMessages.EMERGENCY_TYPE_REQUIRED);
        }

        List<DiversionScenario> feasible = scenarioCatalog.candidatesFor(emergencyType).stream()
                .filter(scenario -> flight.canCompleteDiversion(scenario.getEstimatedFlightTime()))
                .filter(scenario -> flight.canAcceptDiversion(scenario.getCrewTimeUsed()))
                .collect(Collectors.toList());

        log.debug("Diversion candidates generated: flight={}, emergency={}, count={}",
                flight.getFlightNumber(), emergencyType, feasible.size());
        return feasible;
    }

    // ========== Feasibility ==========

    /**
     * Blocking limitations make the scenario infeasible; advisory ones are reported alongside.
     */
    public FeasibilityResult validateDiversionFeasibility(FlightState flight, DiversionScenario scenario) {
        DiversionInputValidator.validateFlight(flight);
        DiversionInputValidator.validateScenario(scenario);

        List<FeasibilityLimitation> limitations = new ArrayList<>();
        if (!flight.canCompleteDiversion(scenario.getEstimatedFlightTime())) {
            limitations.add(FeasibilityLimitation.INSUFFICIENT_FUEL);
        }
        if (!flight.canAcceptDiversion(scenario.getCrewTimeUsed())) {
            limitations.add(FeasibilityLimitation.CREW_DUTY_EXCEEDED);
        }
        if (flight.getFuelOnBoard() - scenario.getExtraFuelBurn() < FUEL_RISK_CRITICAL_KG) {
            limitations.add(FeasibilityLimitation.POST_DIVERSION_FUEL_CRITICAL);
        }
        if (flight.getCrewOnDuty() - scenario.getCrewTimeUsed() < CREW_APPROACHING_LIMIT_MINUTES) {
            limitations.add(FeasibilityLimitation.POST_DIVERSION_CREW_LOW);
        }

        boolean feasible = limitations.stream().noneMatch(FeasibilityLimitation::isBlocking);
        if (!feasible) {
            log.info("Diversion infeasible: flight={}, airport={}, limitations={}",
                    flight.getFlightNumber(), scenario.getAirport(), limitations);
        }

        return FeasibilityResult.builder()
                .feasible(feasible)
                .limitations(limitations)
                .build();
    }
}
