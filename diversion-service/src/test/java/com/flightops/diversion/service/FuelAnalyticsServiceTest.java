package com.flightops.diversion.service;

import com.flightops.diversion.dto.FuelCostAnalysis;
import com.flightops.diversion.dto.FuelDecisionAnalysis;
import com.flightops.diversion.dto.FuelMonitoringResult;
import com.flightops.diversion.dto.FuelOperationRecord;
import com.flightops.diversion.dto.FuelOptimizationResult;
import com.flightops.diversion.enums.FuelMonitorStatus;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.enums.WeatherSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FuelAnalyticsService Unit Tests")
class FuelAnalyticsServiceTest {

    private FuelAnalyticsService fuelAnalyticsService;

    @BeforeEach
    void setUp() {
        fuelAnalyticsService = new FuelAnalyticsService(new AircraftPerformanceService());
    }

    @Nested
    @DisplayName("Fuel Decision Tests")
    class FuelDecisionTests {

        @Test
        @DisplayName("Should price wasted fuel at the default rate")
        void evaluateFuelDecision_Overload_ModerateEfficiency() {
            FuelDecisionAnalysis analysis = fuelAnalyticsService.evaluateFuelDecision(5_000, 4_000);

            assertThat(analysis.getWastedFuel()).isEqualTo(1_000);
            assertThat(analysis.getCost()).isEqualByComparingTo("820.00");
            assertThat(analysis.getEfficiency()).isEqualTo(80.0);
            assertThat(analysis.getRecommendation())
                    .isEqualTo("Moderate efficiency - review fuel planning procedures");
        }

        @Test
        @DisplayName("Should rate exact planning as excellent")
        void evaluateFuelDecision_Exact_Excellent() {
            FuelDecisionAnalysis analysis = fuelAnalyticsService.evaluateFuelDecision(4_000, 4_000, 1.10);

            assertThat(analysis.getWastedFuel()).isZero();
            assertThat(analysis.getCost()).isEqualByComparingTo("0");
            assertThat(analysis.getEfficiency()).isEqualTo(100.0);
            assertThat(analysis.getRecommendation()).isEqualTo("Excellent fuel planning - minimal waste");
        }

        @Test
        @DisplayName("Should rate zero actual burn as poor")
        void evaluateFuelDecision_NoBurn_Poor() {
            FuelDecisionAnalysis analysis = fuelAnalyticsService.evaluateFuelDecision(5_000, 0);

            assertThat(analysis.getEfficiency()).isZero();
            assertThat(analysis.getWastedFuel()).isEqualTo(5_000);
            assertThat(analysis.getRecommendation())
                    .isEqualTo("Poor efficiency - significant fuel planning improvements needed");
        }

        @Test
        @DisplayName("Should cap efficiency at 100 when burn exceeds the request")
        void evaluateFuelDecision_Underload_Capped() {
            FuelDecisionAnalysis analysis = fuelAnalyticsService.evaluateFuelDecision(3_000, 3_500);

            assertThat(analysis.getEfficiency()).isEqualTo(100.0);
            assertThat(analysis.getWastedFuel()).isZero();
        }
    }

    @Nested
    @DisplayName("Planning Tests")
    class PlanningTests {

        @Test
        @DisplayName("Should add contingency, alternate and final reserve to trip fuel")
        void calculateScenarioFuel_GoodWeather() {
            assertThat(fuelAnalyticsService.calculateScenarioFuel(1_000, "B787", WeatherSeverity.GOOD))
                    .isEqualTo(6_630);
        }

        @Test
        @DisplayName("Should apply the altitude restriction factor")
        void calculateScenarioFuel_AltitudeRestricted() {
            assertThat(fuelAnalyticsService.calculateScenarioFuel(1_000, "B787", WeatherSeverity.GOOD, true))
                    .isEqualTo(7_596);
        }

        @Test
        @DisplayName("Should plan unknown types on the default burn")
        void calculateScenarioFuel_UnknownType_Default() {
            assertThat(fuelAnalyticsService.calculateScenarioFuel(1_000, "C919", null)).isEqualTo(6_975);
        }

        @Test
        @DisplayName("Should suggest reducing an overloaded plan")
        void optimizeFuelLoading_Overloaded_Low() {
            FuelOptimizationResult result =
                    fuelAnalyticsService.optimizeFuelLoading(10_000, 1_000, "B787", WeatherSeverity.GOOD);

            assertThat(result.getOptimizedBurn()).isEqualTo(6_630);
            assertThat(result.getPotentialSavings()).isEqualTo(3_370);
            assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.getRecommendations()).first().isEqualTo("Consider reducing fuel load by 3370 kg");
        }

        @Test
        @DisplayName("Should flag an underloaded plan as critical")
        void optimizeFuelLoading_Underloaded_Critical() {
            FuelOptimizationResult result =
                    fuelAnalyticsService.optimizeFuelLoading(6_000, 1_000, "B787", WeatherSeverity.GOOD);

            assertThat(result.getPotentialSavings()).isZero();
            assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(result.getRecommendations())
                    .contains("Consider increasing fuel load for safety margin",
                            "CRITICAL: Fuel load below minimum safe requirements");
        }

        @Test
        @DisplayName("Should flag a thin margin as high risk")
        void optimizeFuelLoading_ThinMargin_High() {
            FuelOptimizationResult result =
                    fuelAnalyticsService.optimizeFuelLoading(6_800, 1_000, "B787", WeatherSeverity.GOOD);

            assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("Should flag loads well above the historical average")
        void optimizeFuelLoading_AboveHistory_Flagged() {
            FuelOptimizationResult result = fuelAnalyticsService.optimizeFuelLoading(
                    10_000, 1_000, "B787", WeatherSeverity.GOOD, List.of(7_000, 7_000));

            assertThat(result.isExceedsHistoricalAverage()).isTrue();
            assertThat(result.getRecommendations()).contains("Fuel load significantly above historical average");
        }
    }

    @Nested
    @DisplayName("Monitoring Tests")
    class MonitoringTests {

        @Test
        @DisplayName("Should report caution for a small margin over minimum and alternate")
        void monitorFlightFuel_SmallMargin_Caution() {
            FuelMonitoringResult result = fuelAnalyticsService.monitorFlightFuel(20_000, 6_800, 2.0, 3_000, 2_000);

            assertThat(result.getProjectedFuelAtDestination()).isEqualTo(6_400);
            assertThat(result.getFuelMargin()).isEqualTo(1_400);
            assertThat(result.getStatus()).isEqualTo(FuelMonitorStatus.CAUTION);
            assertThat(result.getAlerts()).containsExactly("CAUTION: Monitor fuel consumption closely");
        }

        @Test
        @DisplayName("Should report normal status without alerts")
        void monitorFlightFuel_Ample_Normal() {
            FuelMonitoringResult result = fuelAnalyticsService.monitorFlightFuel(30_000, 6_800, 2.0, 3_000);

            assertThat(result.getStatus()).isEqualTo(FuelMonitorStatus.NORMAL);
            assertThat(result.getAlerts()).isEmpty();
        }

        @Test
        @DisplayName("Should report critical when projected fuel falls below minimum")
        void monitorFlightFuel_Short_Critical() {
            FuelMonitoringResult result = fuelAnalyticsService.monitorFlightFuel(15_000, 6_800, 2.0, 3_000);

            assertThat(result.getStatus()).isEqualTo(FuelMonitorStatus.CRITICAL);
            assertThat(result.getFuelMargin()).isEqualTo(-1_600);
        }

        @Test
        @DisplayName("Should grade remaining fuel on strict thresholds")
        void assessRemainingFuelRisk_Thresholds() {
            assertThat(fuelAnalyticsService.assessRemainingFuelRisk(7_999)).isEqualTo(RiskLevel.CRITICAL);
            assertThat(fuelAnalyticsService.assessRemainingFuelRisk(8_000)).isEqualTo(RiskLevel.HIGH);
            assertThat(fuelAnalyticsService.assessRemainingFuelRisk(12_000)).isEqualTo(RiskLevel.MEDIUM);
            assertThat(fuelAnalyticsService.assessRemainingFuelRisk(18_000)).isEqualTo(RiskLevel.LOW);
        }
    }

    @Nested
    @DisplayName("Cost Analysis Tests")
    class CostAnalysisTests {

        @Test
        @DisplayName("Should summarise routes and name the inefficient ones")
        void calculateFuelCostAnalysis_MixedRoutes() {
            List<FuelOperationRecord> operations = List.of(
                    FuelOperationRecord.builder().route("LHR-JFK").fuelUsed(8_000).fuelPlanned(10_000).distance(2_000).build(),
                    FuelOperationRecord.builder().route("CDG-FRA").fuelUsed(4_750).fuelPlanned(5_000).distance(1_000).build());

            FuelCostAnalysis analysis = fuelAnalyticsService.calculateFuelCostAnalysis(operations);

            assertThat(analysis.getSummary().getTotalOperations()).isEqualTo(2);
            assertThat(analysis.getSummary().getTotalWastedFuel()).isEqualTo(2_250);
            assertThat(analysis.getSummary().getTotalWasteCost()).isEqualByComparingTo("1845");
            assertThat(analysis.getSummary().getAverageEfficiency()).isEqualTo(87.5);

            FuelCostAnalysis.RouteEfficiency transatlantic = analysis.getRouteAnalysis().get(0);
            assertThat(transatlantic.getEfficiency()).isEqualTo(80.0);
            assertThat(transatlantic.getCost()).isEqualByComparingTo("1640");
            assertThat(transatlantic.getFuelPerKm()).isEqualTo(4.0);

            assertThat(analysis.getRecommendations()).hasSize(4)
                    .contains("Review fuel planning for routes: LHR-JFK", "High fuel waste detected on: LHR-JFK");
        }

        @Test
        @DisplayName("Should return an empty summary for no operations")
        void calculateFuelCostAnalysis_Empty() {
            FuelCostAnalysis analysis = fuelAnalyticsService.calculateFuelCostAnalysis(List.of());

            assertThat(analysis.getSummary().getTotalOperations()).isZero();
            assertThat(analysis.getSummary().getTotalWasteCost()).isEqualByComparingTo("0");
        }
    }
}
