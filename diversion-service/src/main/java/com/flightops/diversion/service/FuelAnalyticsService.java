package com.flightops.diversion.service;

import com.flightops.diversion.dto.FuelCostAnalysis;
import com.flightops.diversion.dto.FuelDecisionAnalysis;
import com.flightops.diversion.dto.FuelMonitoringResult;
import com.flightops.diversion.dto.FuelOperationRecord;
import com.flightops.diversion.dto.FuelOptimizationResult;
import com.flightops.diversion.enums.FuelMonitorStatus;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.enums.WeatherSeverity;
import com.flightops.diversion.model.AircraftPerformanceProfile;
import com.flightops.diversion.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.flightops.diversion.constants.DiversionConstants.ALTERNATE_FUEL_RATE;
import static com.flightops.diversion.constants.DiversionConstants.ALTITUDE_RESTRICTION_FACTOR;
import static com.flightops.diversion.constants.DiversionConstants.CONTINGENCY_FUEL_RATE;
import static com.flightops.diversion.constants.DiversionConstants.DEFAULT_FUEL_PRICE_PER_KG;
import static com.flightops.diversion.constants.DiversionConstants.FINAL_RESERVE_FUEL_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_MARGIN_CAUTION_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_MARGIN_CRITICAL_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_MARGIN_MONITOR_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_RISK_CRITICAL_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_RISK_HIGH_KG;
import static com.flightops.diversion.constants.DiversionConstants.FUEL_RISK_MEDIUM_KG;
import static com.flightops.diversion.constants.DiversionConstants.HIGH_WASTE_KG;
import static com.flightops.diversion.constants.DiversionConstants.HISTORICAL_OVERLOAD_FACTOR;
import static com.flightops.diversion.constants.DiversionConstants.SIGNIFICANT_SAVINGS_KG;

/**
 * Fuel planning and monitoring calculators. Stateless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FuelAnalyticsService {

    private static final double EXCELLENT_EFFICIENCY = 95;
    private static final double GOOD_EFFICIENCY = 85;
    private static final double MODERATE_EFFICIENCY = 70;
    private static final double TARGET_AVERAGE_EFFICIENCY = 90;

    private final AircraftPerformanceService performanceService;

    // ========== Fuel Decisions ==========

    public FuelDecisionAnalysis evaluateFuelDecision(int requestedExtra, int actualBurn) {
        return evaluateFuelDecision(requestedExtra, actualBurn, DEFAULT_FUEL_PRICE_PER_KG);
    }

    public FuelDecisionAnalysis evaluateFuelDecision(int requestedExtra, int actualBurn, double costPerKg) {
        int wastedFuel = Math.max(0, requestedExtra - actualBurn);
        double efficiency = efficiency(requestedExtra, actualBurn);

        FuelDecisionAnalysis analysis = FuelDecisionAnalysis.builder()
                .requestedExtra(requestedExtra)
                .actualBurn(actualBurn)
                .wastedFuel(wastedFuel)
                .cost(MoneyUtils.cents(wastedFuel * costPerKg))
                .efficiency(roundToTenth(efficiency))
                .recommendation(efficiencyRecommendation(efficiency))
                .build();

        log.debug("Fuel decision evaluated: requested={}, actual={}, efficiency={}",
                requestedExtra, actualBurn, analysis.getEfficiency());
        return analysis;
    }

    // ========== Planning ==========

    public int calculateScenarioFuel(int distanceKm, String aircraftType, WeatherSeverity weather) {
        return calculateScenarioFuel(distanceKm, aircraftType, weather, false);
    }

    /**
     * Trip fuel for the distance plus 5% contingency, 10% alternate and the final reserve, in whole kg.
     */
    public int calculateScenarioFuel(int distanceKm, String aircraftType, WeatherSeverity weather,
                                     boolean altitudeRestricted) {
        AircraftPerformanceProfile profile = performanceService.profileFor(aircraftType);
        WeatherSeverity severity = weather != null ? weather : WeatherSeverity.GOOD;

        double tripFuel = distanceKm * profile.getBurnPerKm() * severity.getFuelMultiplier();
        if (altitudeRestricted) {
            tripFuel *= ALTITUDE_RESTRICTION_FACTOR;
        }

        double contingency = tripFuel * CONTINGENCY_FUEL_RATE;
        double alternate = tripFuel * ALTERNATE_FUEL_RATE;
        return (int) Math.round(tripFuel + contingency + alternate + FINAL_RESERVE_FUEL_KG);
    }

    public FuelOptimizationResult optimizeFuelLoading(int plannedFuel, int distanceKm, String aircraftType,
                                                      WeatherSeverity weather) {
        return optimizeFuelLoading(plannedFuel, distanceKm, aircraftType, weather, List.of());
    }

    public FuelOptimizationResult optimizeFuelLoading(int plannedFuel, int distanceKm, String aircraftType,
                                                      WeatherSeverity weather, List<Integer> historicalLoads) {
        int recommendedFuel = calculateScenarioFuel(distanceKm, aircraftType, weather);
        int potentialSavings = Math.max(0, plannedFuel - recommendedFuel);
        List<String> recommendations = new ArrayList<>();

        if (potentialSavings > SIGNIFICANT_SAVINGS_KG) {
            recommendations.add("Consider reducing fuel load by " + potentialSavings + " kg");
            recommendations.add("Review weather forecast for potential optimization");
        } else if (plannedFuel < recommendedFuel) {
            recommendations.add("Consider increasing fuel load for safety margin");
            recommendations.add("Current load may be insufficient for conditions");
        }

        boolean aboveHistorical = false;
        if (historicalLoads != null && !historicalLoads.isEmpty()) {
            double average = historicalLoads.stream().mapToInt(Integer::intValue).average().orElse(0);
            if (plannedFuel > average * HISTORICAL_OVERLOAD_FACTOR) {
                aboveHistorical = true;
                recommendations.add("Fuel load significantly above historical average");
            }
        }

        double margin = (double) (plannedFuel - recommendedFuel) / recommendedFuel;
        RiskLevel riskLevel = RiskLevel.LOW;
        if (margin < -0.05) {
            riskLevel = RiskLevel.CRITICAL;
            recommendations.add("CRITICAL: Fuel load below minimum safe requirements");
        } else if (margin < 0.05) {
            riskLevel = RiskLevel.HIGH;
            recommendations.add("HIGH RISK: Minimal fuel margin for contingencies");
        } else if (margin < 0.15) {
            riskLevel = RiskLevel.MEDIUM;
        }

        return FuelOptimizationResult.builder()
                .currentBurn(plannedFuel)
                .optimizedBurn(recommendedFuel)
                .potentialSavings(potentialSavings)
                .exceedsHistoricalAverage(aboveHistorical)
                .recommendations(recommendations)
                .riskLevel(riskLevel)
                .build();
    }

    // ========== Monitoring ==========

    public FuelMonitoringResult monitorFlightFuel(int currentFuel, double burnRatePerHour, double remainingHours,
                                                  int minimumRequired) {
        return monitorFlightFuel(currentFuel, burnRatePerHour, remainingHours, minimumRequired, 0);
    }

    public FuelMonitoringResult monitorFlightFuel(int currentFuel, double burnRatePerHour, double remainingHours,
                                                  int minimumRequired, int alternateRequired) {
        double projected = currentFuel - burnRatePerHour * remainingHours;
        double margin = projected - (minimumRequired + alternateRequired);

        FuelMonitorStatus status;
        List<String> alerts = new ArrayList<>();
        if (margin < FUEL_MARGIN_CRITICAL_KG) {
            status = FuelMonitorStatus.CRITICAL;
            alerts.add("CRITICAL: Fuel state approaching minimum limits");
        } else if (margin < FUEL_MARGIN_CAUTION_KG) {
            status = FuelMonitorStatus.CAUTION;
            alerts.add("CAUTION: Monitor fuel consumption closely");
        } else if (margin < FUEL_MARGIN_MONITOR_KG) {
            status = FuelMonitorStatus.MONITOR;
            alerts.add("Monitor fuel consumption");
        } else {
            status = FuelMonitorStatus.NORMAL;
        }

        if (status == FuelMonitorStatus.CRITICAL) {
            log.warn("Fuel margin critical: currentFuel={}, margin={}", currentFuel, Math.round(margin));
        }

        return FuelMonitoringResult.builder()
                .currentFuel(currentFuel)
                .projectedFuelAtDestination((int) Math.round(projected))
                .fuelMargin((int) Math.round(margin))
                .status(status)
                .alerts(alerts)
                .recommendedAction(status.getRecommendedAction())
                .build();
    }

    /**
     * Fuel axis of a diversion risk assessment, graded on kg remaining after the diversion.
     */
    public RiskLevel assessRemainingFuelRisk(int fuelRemainingKg) {
        if (fuelRemainingKg < FUEL_RISK_CRITICAL_KG) {
            return RiskLevel.CRITICAL;
        }
        if (fuelRemainingKg < FUEL_RISK_HIGH_KG) {
            return RiskLevel.HIGH;
        }
        if (fuelRemainingKg < FUEL_RISK_MEDIUM_KG) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    // ========== Cost Analysis ==========

    public FuelCostAnalysis calculateFuelCostAnalysis(List<FuelOperationRecord> operations) {
        if (operations == null || operations.isEmpty()) {
            return FuelCostAnalysis.builder()
                    .summary(FuelCostAnalysis.Summary.builder()
                            .totalOperations(0)
                            .totalWasteCost(BigDecimal.ZERO)
                            .build())
                    .build();
        }

        List<FuelCostAnalysis.RouteEfficiency> routes = new ArrayList<>(operations.size());
        int totalWaste = 0;
        double totalCost = 0;

        for (FuelOperationRecord operation : operations) {
            int waste = Math.max(0, operation.getFuelPlanned() - operation.getFuelUsed());
            double cost = waste * DEFAULT_FUEL_PRICE_PER_KG;
            double efficiency = operation.getFuelUsed() > 0 && operation.getFuelPlanned() > 0
                    ? (double) operation.getFuelUsed() / operation.getFuelPlanned() * 100
                    : 0;
            double fuelPerKm = operation.getDistance() > 0
                    ? Math.round((double) operation.getFuelUsed() / operation.getDistance() * 100) / 100.0
                    : 0;

            totalWaste += waste;
            totalCost += cost;
            routes.add(FuelCostAnalysis.RouteEfficiency.builder()
                    .route(operation.getRoute())
                    .efficiency(roundToTenth(efficiency))
                    .waste(waste)
                    .cost(MoneyUtils.wholeDollars(cost))
                    .fuelPerKm(fuelPerKm)
                    .build());
        }

        double averageEfficiency = routes.stream()
                .mapToDouble(FuelCostAnalysis.RouteEfficiency::getEfficiency)
                .average()
                .orElse(0);

        return FuelCostAnalysis.builder()
                .summary(FuelCostAnalysis.Summary.builder()
                        .totalOperations(operations.size())
                        .totalWastedFuel(totalWaste)
                        .totalWasteCost(MoneyUtils.wholeDollars(totalCost))
                        .averageEfficiency(roundToTenth(averageEfficiency))
                        .build())
                .routeAnalysis(routes)
                .recommendations(routeRecommendations(routes, averageEfficiency))
                .build();
    }

    private List<String> routeRecommendations(List<FuelCostAnalysis.RouteEfficiency> routes,
                                              double averageEfficiency) {
        List<String> recommendations = new ArrayList<>();

        String lowEfficiency = routes.stream()
                .filter(route -> route.getEfficiency() < GOOD_EFFICIENCY)
                .map(FuelCostAnalysis.RouteEfficiency::getRoute)
                .collect(Collectors.joining(", "));
        if (!lowEfficiency.isEmpty()) {
            recommendations.add("Review fuel planning for routes: " + lowEfficiency);
        }

        String highWaste = routes.stream()
                .filter(route -> route.getWaste() > HIGH_WASTE_KG)
                .map(FuelCostAnalysis.RouteEfficiency::getRoute)
                .collect(Collectors.joining(", "));
        if (!highWaste.isEmpty()) {
            recommendations.add("High fuel waste detected on: " + highWaste);
        }

        if (averageEfficiency < TARGET_AVERAGE_EFFICIENCY) {
            recommendations.add("Consider implementing dynamic fuel planning based on real-time conditions");
            recommendations.add("Review historical fuel consumption patterns for optimization");
        }
        return recommendations;
    }

    private static double efficiency(int requestedExtra, int actualBurn) {
        if (actualBurn <= 0) {
            return 0;
        }
        if (requestedExtra <= 0) {
            return 100;
        }
        return Math.min(100, (double) actualBurn / requestedExtra * 100);
    }

    private static String efficiencyRecommendation(double efficiency) {
        if (efficiency >= EXCELLENT_EFFICIENCY) {
            return "Excellent fuel planning - minimal waste";
        }
        if (efficiency >= GOOD_EFFICIENCY) {
            return "Good fuel planning - minor optimization possible";
        }
        if (efficiency >= MODERATE_EFFICIENCY) {
            return "Moderate efficiency - review fuel planning procedures";
        }
        return "Poor efficiency - significant fuel planning improvements needed";
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
