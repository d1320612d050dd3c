package com.flightops.diversion.service;

import com.flightops.diversion.constants.ValidationMessages;
import com.flightops.diversion.dto.CostBenefitOption;
import com.flightops.diversion.dto.CostBenefitResult;
import com.flightops.diversion.dto.CostEstimate;
import com.flightops.diversion.dto.CustomerImpactScore;
import com.flightops.diversion.dto.DiversionResult;
import com.flightops.diversion.dto.InsuranceLiability;
import com.flightops.diversion.dto.OperationalImpactCost;
import com.flightops.diversion.enums.CostRegion;
import com.flightops.diversion.enums.CustomerImpactCategory;
import com.flightops.diversion.enums.EmergencyType;
import com.flightops.diversion.enums.IncidentSeverity;
import com.flightops.diversion.enums.Urgency;
import com.flightops.diversion.exception.DiversionValidationException;
import com.flightops.diversion.util.MoneyUtils;
import com.flightops.diversion.validator.DiversionInputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.flightops.diversion.constants.DiversionConstants.AIRCRAFT_HOURLY_UTILIZATION_COST;
import static com.flightops.diversion.constants.DiversionConstants.AVERAGE_FLIGHT_REVENUE;
import static com.flightops.diversion.constants.DiversionConstants.BASE_CREW_SIZE;
import static com.flightops.diversion.constants.DiversionConstants.COMPENSATION_LONG;
import static com.flightops.diversion.constants.DiversionConstants.COMPENSATION_MEDIUM;
import static com.flightops.diversion.constants.DiversionConstants.CREW_COST_LONG_DELAY;
import static com.flightops.diversion.constants.DiversionConstants.CREW_COST_MEDIUM_DELAY;
import static com.flightops.diversion.constants.DiversionConstants.CREW_COST_SHORT_DELAY;
import static com.flightops.diversion.constants.DiversionConstants.CREW_OVERTIME_FREE_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.CREW_OVERTIME_HOURLY_RATE;
import static com.flightops.diversion.constants.DiversionConstants.CREW_POSITIONING_COST;
import static com.flightops.diversion.constants.DiversionConstants.CREW_POSITIONING_DELAY_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_COMPENSATION_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_CREW_OVERTIME_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_HIGH_COMPENSATION_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DELAY_SEVERE_THRESHOLD;
import static com.flightops.diversion.constants.DiversionConstants.DISRUPTION_FUEL_PRICE_PER_KG;
import static com.flightops.diversion.constants.DiversionConstants.DIVERSION_BASE_FUEL_KG;
import static com.flightops.diversion.constants.DiversionConstants.DIVERSION_HOURLY_FUEL_KG;
import static com.flightops.diversion.constants.DiversionConstants.DOWNSTREAM_REVENUE_IMPACT;
import static com.flightops.diversion.constants.DiversionConstants.HANDLING_EMERGENCY;
import static com.flightops.diversion.constants.DiversionConstants.HANDLING_FEE_PER_PASSENGER;
import static com.flightops.diversion.constants.DiversionConstants.HANDLING_STANDARD;
import static com.flightops.diversion.constants.DiversionConstants.HANDLING_URGENT;
import static com.flightops.diversion.constants.DiversionConstants.INSURANCE_DEDUCTIBLE_RATE;
import static com.flightops.diversion.constants.DiversionConstants.INSURANCE_SETTLEMENT_RATE;
import static com.flightops.diversion.constants.DiversionConstants.MEAL_INTERVAL_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.OPERATIONAL_OVERHEAD_RATE;
import static com.flightops.diversion.constants.DiversionConstants.PASSENGER_COST_LONG_DELAY;
import static com.flightops.diversion.constants.DiversionConstants.PASSENGER_COST_MEDIUM_DELAY;
import static com.flightops.diversion.constants.DiversionConstants.SCENARIO_FUEL_PRICE_PER_KG;
import static com.flightops.diversion.constants.DiversionConstants.SCORE_CAP;
import static com.flightops.diversion.constants.DiversionConstants.SCORE_MISSED_CONNECTION;
import static com.flightops.diversion.constants.DiversionConstants.SCORE_PER_DELAY_MINUTE;
import static com.flightops.diversion.constants.DiversionConstants.SCORE_REROUTE;
import static com.flightops.diversion.constants.DiversionConstants.SLOT_LOSS_COST;
import static com.flightops.diversion.constants.DiversionConstants.TIME_COST_PER_MINUTE;

/**
 * Disruption cost and customer impact calculators. All amounts are USD.
 */
@Service
@Slf4j
public class CostModelService {

    private static final Map<EmergencyType, Map<IncidentSeverity, Integer>> BASE_LIABILITY =
            new EnumMap<>(EmergencyType.class);

    static {
        BASE_LIABILITY.put(EmergencyType.MEDICAL, liability(50_000, 200_000, 500_000));
        BASE_LIABILITY.put(EmergencyType.TECHNICAL, liability(25_000, 150_000, 750_000));
        BASE_LIABILITY.put(EmergencyType.WEATHER, liability(10_000, 75_000, 300_000));
    }

    // ========== Scenario Costs ==========

    /**
     * Direct costs of a simulated diversion: fuel, handling, passenger care and crew.
     */
    public DiversionResult.AdditionalCosts calculateScenarioCosts(int extraFuelBurn, int delayMinutes,
                                                                  Urgency urgency) {
        double fuel = extraFuelBurn * SCENARIO_FUEL_PRICE_PER_KG;
        int handling = handlingFee(urgency);
        int passenger = passengerCost(delayMinutes);
        int crew = crewCost(delayMinutes);

        return DiversionResult.AdditionalCosts.builder()
                .fuel(MoneyUtils.wholeDollars(fuel))
                .handling(BigDecimal.valueOf(handling))
                .passenger(BigDecimal.valueOf(passenger))
                .crew(BigDecimal.valueOf(crew))
                .total(MoneyUtils.wholeDollars(fuel + handling + passenger + crew))
                .build();
    }

    private static int handlingFee(Urgency urgency) {
        if (urgency == Urgency.EMERGENCY) {
            return HANDLING_EMERGENCY;
        }
        if (urgency == Urgency.URGENT) {
            return HANDLING_URGENT;
        }
        return HANDLING_STANDARD;
    }

    private static int passengerCost(int delayMinutes) {
        if (delayMinutes <= DELAY_COMPENSATION_THRESHOLD) {
            return 0;
        }
        if (delayMinutes <= DELAY_SEVERE_THRESHOLD) {
            return PASSENGER_COST_MEDIUM_DELAY;
        }
        return PASSENGER_COST_LONG_DELAY;
    }

    private static int crewCost(int delayMinutes) {
        if (delayMinutes > DELAY_HIGH_COMPENSATION_THRESHOLD) {
            return CREW_COST_LONG_DELAY;
        }
        if (delayMinutes > DELAY_CREW_OVERTIME_THRESHOLD) {
            return CREW_COST_MEDIUM_DELAY;
        }
        return CREW_COST_SHORT_DELAY;
    }

    // ========== Disruption Estimate ==========

    public CostEstimate estimateDiversionCost(int passengers) {
        return estimateDiversionCost(passengers, CostRegion.EUROPEAN, false, 0);
    }

    public CostEstimate estimateDiversionCost(int passengers, CostRegion region, boolean overnightRequired,
                                              double delayHours) {
        DiversionInputValidator.validatePassengerCount(passengers);
        DiversionInputValidator.validateRegion(region);

        long hotel = overnightRequired ? (long) passengers * region.getHotelRate() : 0;
        long meals = (long) passengers * region.getMealRate() * (long) Math.ceil(delayHours / MEAL_INTERVAL_HOURS);
        long rebooking = (long) passengers * region.getRebookingRate();

        long passengerSubtotal = hotel + meals + rebooking;
        double overhead = passengerSubtotal * OPERATIONAL_OVERHEAD_RATE;
        double crewCosts = disruptionCrewCost(delayHours, overnightRequired, region);
        double fuelCosts = (DIVERSION_BASE_FUEL_KG + delayHours * DIVERSION_HOURLY_FUEL_KG) * DISRUPTION_FUEL_PRICE_PER_KG;
        long handlingFees = region.getHandlingBaseFee() + (long) passengers * HANDLING_FEE_PER_PASSENGER;

        double total = passengerSubtotal + overhead + crewCosts + fuelCosts + handlingFees;

        CostEstimate estimate = CostEstimate.builder()
                .hotel(BigDecimal.valueOf(hotel))
                .meals(BigDecimal.valueOf(meals))
                .rebooking(BigDecimal.valueOf(rebooking))
                .total(MoneyUtils.wholeDollars(total))
                .breakdown(CostEstimate.Breakdown.builder()
                        .perPassenger(MoneyUtils.wholeDollars((double) passengerSubtotal / passengers))
                        .operationalOverhead(MoneyUtils.wholeDollars(overhead))
                        .crewCosts(MoneyUtils.wholeDollars(crewCosts))
                        .fuelCosts(MoneyUtils.wholeDollars(fuelCosts))
                        .handlingFees(BigDecimal.valueOf(handlingFees))
                        .build())
                .build();

        log.debug("Diversion cost estimated: passengers={}, region={}, overnight={}, delayHours={}, total={}",
                passengers, region.getCode(), overnightRequired, delayHours, estimate.getTotal());
        return estimate;
    }

    private static double disruptionCrewCost(double delayHours, boolean overnightRequired, CostRegion region) {
        double cost = 0;
        if (delayHours > CREW_OVERTIME_FREE_HOURS) {
            cost += BASE_CREW_SIZE * (delayHours - CREW_OVERTIME_FREE_HOURS) * CREW_OVERTIME_HOURLY_RATE;
        }
        if (overnightRequired) {
            cost += BASE_CREW_SIZE * region.getCrewAccommodationRate();
        }
        if (delayHours > CREW_POSITIONING_DELAY_HOURS) {
            cost += CREW_POSITIONING_COST;
        }
        return cost;
    }

    // ========== Customer Impact ==========

    public CustomerImpactScore customerDisruptionScore(int delayMinutes) {
        return customerDisruptionScore(delayMinutes, false, false);
    }

    public CustomerImpactScore customerDisruptionScore(int delayMinutes, boolean rerouteRequired,
                                                       boolean missedConnection) {
        double raw = delayMinutes * SCORE_PER_DELAY_MINUTE;
        if (rerouteRequired) {
            raw += SCORE_REROUTE;
        }
        if (missedConnection) {
            raw += SCORE_MISSED_CONNECTION;
        }
        double capped = Math.min(raw, SCORE_CAP);

        boolean compensationRequired = delayMinutes > DELAY_COMPENSATION_THRESHOLD;
        int compensation = 0;
        if (compensationRequired) {
            compensation = delayMinutes > DELAY_HIGH_COMPENSATION_THRESHOLD ? COMPENSATION_LONG : COMPENSATION_MEDIUM;
        }

        return CustomerImpactScore.builder()
                .score((int) Math.round(capped))
                .factors(CustomerImpactScore.Factors.builder()
                        .delayMinutes(delayMinutes)
                        .rerouteRequired(rerouteRequired)
                        .missedConnection(missedConnection)
                        .compensationRequired(compensationRequired)
                        .build())
                .category(categoryFor(capped))
                .estimatedCompensation(BigDecimal.valueOf(compensation))
                .build();
    }

    private static CustomerImpactCategory categoryFor(double score) {
        if (score >= 80) {
            return CustomerImpactCategory.SEVERE;
        }
        if (score >= 60) {
            return CustomerImpactCategory.HIGH;
        }
        if (score >= 30) {
            return CustomerImpactCategory.MODERATE;
        }
        return CustomerImpactCategory.LOW;
    }

    // ========== Operational Impact ==========

    public OperationalImpactCost calculateOperationalImpact(CostEstimate diversionCost, int downstreamFlights,
                                                            boolean slotLoss, double utilizationLossHours) {
        if (diversionCost == null || diversionCost.getTotal() == null) {
            throw new DiversionValidationException(ValidationMessages.COST_ESTIMATE_REQUIRED);
        }

        BigDecimal downstream = MoneyUtils.wholeDollars(
                downstreamFlights * AVERAGE_FLIGHT_REVENUE * DOWNSTREAM_REVENUE_IMPACT);
        BigDecimal slot = slotLoss ? BigDecimal.valueOf(SLOT_LOSS_COST) : BigDecimal.ZERO;
        BigDecimal utilization = MoneyUtils.wholeDollars(utilizationLossHours * AIRCRAFT_HOURLY_UTILIZATION_COST);

        return OperationalImpactCost.builder()
                .diversionCost(diversionCost.getTotal())
                .downstreamImpact(downstream)
                .slotLossCost(slot)
                .utilizationLoss(utilization)
                .totalOperationalCost(MoneyUtils.sum(diversionCost.getTotal(), downstream, slot, utilization))
                .build();
    }

    // ========== Cost-Benefit ==========

    /**
     * Weighs mitigation options; cheapest total weighted cost first.
     */
    public List<CostBenefitResult> generateCostBenefitAnalysis(List<CostBenefitOption> options) {
        if (options == null || options.isEmpty()) {
            return List.of();
        }

        return options.stream()
                .map(this::weigh)
                .sorted(Comparator.comparing(CostBenefitResult::getTotalWeightedCost))
                .collect(Collectors.toList());
    }

    private CostBenefitResult weigh(CostBenefitOption option) {
        BigDecimal cost = option.getCost() != null ? option.getCost() : BigDecimal.ZERO;
        double expectedValue = cost.doubleValue() * option.getSuccessProbability();
        double riskAdjustment = (100 - option.getRiskReduction()) / 100.0;
        double riskAdjustedCost = expectedValue * (1 + riskAdjustment);
        long timeCost = (long) option.getTimeToImplement() * TIME_COST_PER_MINUTE;
        double totalWeighted = riskAdjustedCost + timeCost;

        BigDecimal totalWeightedCost = MoneyUtils.wholeDollars(totalWeighted);
        BigDecimal costPerRiskReduction = option.getRiskReduction() > 0
                ? BigDecimal.valueOf(totalWeighted)
                        .divide(BigDecimal.valueOf(option.getRiskReduction()), 0, RoundingMode.HALF_UP)
                : null;

        return CostBenefitResult.builder()
                .option(option)
                .expectedValue(MoneyUtils.wholeDollars(expectedValue))
                .riskAdjustedCost(MoneyUtils.wholeDollars(riskAdjustedCost))
                .timeCost(BigDecimal.valueOf(timeCost))
                .totalWeightedCost(totalWeightedCost)
                .costPerRiskReduction(costPerRiskReduction)
                .build();
    }

    // ========== Insurance ==========

    public InsuranceLiability calculateInsuranceLiability(EmergencyType incidentType, IncidentSeverity severity,
                                                          int passengers) {
        if (incidentType == null || severity == null) {
            throw new DiversionValidationException(ValidationMessages.INCIDENT_TYPE_REQUIRED);
        }
        DiversionInputValidator.validateAffectedPassengers(passengers);

        long baseAmount = BASE_LIABILITY.get(incidentType).get(severity);
        double coverage = (double) baseAmount * passengers;
        int potentialClaims = (int) Math.round(passengers * severity.getClaimRate());

        return InsuranceLiability.builder()
                .liabilityCoverage(MoneyUtils.wholeDollars(coverage))
                .deductible(MoneyUtils.wholeDollars(coverage * INSURANCE_DEDUCTIBLE_RATE))
                .potentialClaims(potentialClaims)
                .estimatedPayout(MoneyUtils.wholeDollars(potentialClaims * baseAmount * INSURANCE_SETTLEMENT_RATE))
                .build();
    }

    private static Map<IncidentSeverity, Integer> liability(int minor, int major, int serious) {
        Map<IncidentSeverity, Integer> amounts = new EnumMap<>(IncidentSeverity.class);
        amounts.put(IncidentSeverity.MINOR, minor);
        amounts.put(IncidentSeverity.MAJOR, major);
        amounts.put(IncidentSeverity.SERIOUS, serious);
        return amounts;
    }
}
