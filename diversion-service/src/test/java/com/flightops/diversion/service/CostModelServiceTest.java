package com.flightops.diversion.service;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CostModelService Unit Tests")
class CostModelServiceTest {

    private CostModelService costModelService;

    @BeforeEach
    void setUp() {
        costModelService = new CostModelService();
    }

    @Nested
    @DisplayName("Scenario Cost Tests")
    class ScenarioCostTests {

        @Test
        @DisplayName("Should price an emergency diversion without delay")
        void calculateScenarioCosts_EmergencyNoDelay() {
            DiversionResult.AdditionalCosts costs = costModelService.calculateScenarioCosts(2_800, 0, Urgency.EMERGENCY);

            assertThat(costs.getFuel()).isEqualByComparingTo("2240");
            assertThat(costs.getHandling()).isEqualByComparingTo("8000");
            assertThat(costs.getPassenger()).isEqualByComparingTo("0");
            assertThat(costs.getCrew()).isEqualByComparingTo("500");
            assertThat(costs.getTotal()).isEqualByComparingTo("10740");
        }

        @Test
        @DisplayName("Should charge standard handling for critical urgency")
        void calculateScenarioCosts_Critical_StandardHandling() {
            DiversionResult.AdditionalCosts costs = costModelService.calculateScenarioCosts(0, 200, Urgency.CRITICAL);

            assertThat(costs.getHandling()).isEqualByComparingTo("3000");
            assertThat(costs.getPassenger()).isEqualByComparingTo("15000");
            assertThat(costs.getCrew()).isEqualByComparingTo("2000");
        }
    }

    @Nested
    @DisplayName("Diversion Cost Estimate Tests")
    class EstimateTests {

        @Test
        @DisplayName("Should estimate a European diversion with defaults")
        void estimateDiversionCost_Defaults() {
            CostEstimate estimate = costModelService.estimateDiversionCost(100);

            assertThat(estimate.getHotel()).isEqualByComparingTo("0");
            assertThat(estimate.getMeals()).isEqualByComparingTo("0");
            assertThat(estimate.getRebooking()).isEqualByComparingTo("30000");
            assertThat(estimate.getTotal()).isEqualByComparingTo("42275");
            assertThat(estimate.getBreakdown().getPerPassenger()).isEqualByComparingTo("300");
            assertThat(estimate.getBreakdown().getOperationalOverhead()).isEqualByComparingTo("6000");
            assertThat(estimate.getBreakdown().getCrewCosts()).isEqualByComparingTo("0");
            assertThat(estimate.getBreakdown().getFuelCosts()).isEqualByComparingTo("1275");
            assertThat(estimate.getBreakdown().getHandlingFees()).isEqualByComparingTo("5000");
        }

        @Test
        @DisplayName("Should add hotel, meals and crew costs for an overnight long-haul diversion")
        void estimateDiversionCost_OvernightLonghaul() {
            CostEstimate estimate = costModelService.estimateDiversionCost(150, CostRegion.LONGHAUL, true, 5);

            assertThat(estimate.getHotel()).isEqualByComparingTo("37500");
            assertThat(estimate.getMeals()).isEqualByComparingTo("15000");
            assertThat(estimate.getRebooking()).isEqualByComparingTo("75000");
            assertThat(estimate.getBreakdown().getCrewCosts()).isEqualByComparingTo("4200");
            assertThat(estimate.getBreakdown().getFuelCosts()).isEqualByComparingTo("2125");
            assertThat(estimate.getBreakdown().getHandlingFees()).isEqualByComparingTo("7250");
            assertThat(estimate.getBreakdown().getPerPassenger()).isEqualByComparingTo("850");
            assertThat(estimate.getTotal()).isEqualByComparingTo("166575");
        }

        @Test
        @DisplayName("Should reject a non-positive passenger count")
        void estimateDiversionCost_ZeroPassengers_ThrowsException() {
            assertThatThrownBy(() -> costModelService.estimateDiversionCost(0))
                    .isInstanceOf(DiversionValidationException.class)
                    .hasMessage("Passenger count must be positive");
        }

        @Test
        @DisplayName("Should reject a missing region")
        void estimateDiversionCost_NullRegion_ThrowsException() {
            assertThatThrownBy(() -> costModelService.estimateDiversionCost(100, null, false, 0))
                    .isInstanceOf(DiversionValidationException.class);
        }
    }

    @Nested
    @DisplayName("Customer Impact Tests")
    class CustomerImpactTests {

        @Test
        @DisplayName("Should cap the score at 100 and pay long-delay compensation")
        void customerDisruptionScore_LongDelay_CappedSevere() {
            CustomerImpactScore score = costModelService.customerDisruptionScore(400, true, true);

            assertThat(score.getScore()).isEqualTo(100);
            assertThat(score.getCategory()).isEqualTo(CustomerImpactCategory.SEVERE);
            assertThat(score.getEstimatedCompensation()).isEqualByComparingTo("600");
            assertThat(score.getFactors().isCompensationRequired()).isTrue();
        }

        @Test
        @DisplayName("Should grade a two and a half hour delay as high without compensation")
        void customerDisruptionScore_MediumDelay_High() {
            CustomerImpactScore score = costModelService.customerDisruptionScore(150);

            assertThat(score.getScore()).isEqualTo(75);
            assertThat(score.getCategory()).isEqualTo(CustomerImpactCategory.HIGH);
            assertThat(score.getEstimatedCompensation()).isEqualByComparingTo("0");
            assertThat(score.getFactors().isCompensationRequired()).isFalse();
        }

        @Test
        @DisplayName("Should add reroute points and pay medium compensation past three hours")
        void customerDisruptionScore_Reroute() {
            assertThat(costModelService.customerDisruptionScore(70, true, false).getCategory())
                    .isEqualTo(CustomerImpactCategory.MODERATE);
            assertThat(costModelService.customerDisruptionScore(200).getEstimatedCompensation())
                    .isEqualByComparingTo("400");
            assertThat(costModelService.customerDisruptionScore(20).getCategory())
                    .isEqualTo(CustomerImpactCategory.LOW);
        }
    }

    @Nested
    @DisplayName("Operational Impact Tests")
    class OperationalImpactTests {

        @Test
        @DisplayName("Should add downstream, slot and utilisation losses to the diversion cost")
        void calculateOperationalImpact_AllComponents() {
            CostEstimate estimate = costModelService.estimateDiversionCost(100);

            OperationalImpactCost impact = costModelService.calculateOperationalImpact(estimate, 2, true, 1.5);

            assertThat(impact.getDiversionCost()).isEqualByComparingTo("42275");
            assertThat(impact.getDownstreamImpact()).isEqualByComparingTo("54000");
            assertThat(impact.getSlotLossCost()).isEqualByComparingTo("25000");
            assertThat(impact.getUtilizationLoss()).isEqualByComparingTo("12750");
            assertThat(impact.getTotalOperationalCost()).isEqualByComparingTo("134025");
        }

        @Test
        @DisplayName("Should reject a missing cost estimate")
        void calculateOperationalImpact_NullEstimate_ThrowsException() {
            assertThatThrownBy(() -> costModelService.calculateOperationalImpact(null, 1, false, 0))
                    .isInstanceOf(DiversionValidationException.class)
                    .hasMessage("Cost estimate is required");
        }
    }

    @Nested
    @DisplayName("Cost-Benefit Tests")
    class CostBenefitTests {

        @Test
        @DisplayName("Should order options by total weighted cost")
        void generateCostBenefitAnalysis_SortsByWeightedCost() {
            CostBenefitOption hold = CostBenefitOption.builder()
                    .name("Hold and wait")
                    .cost(new BigDecimal("10000"))
                    .riskReduction(50)
                    .timeToImplement(30)
                    .successProbability(0.8)
                    .build();
            CostBenefitOption divert = CostBenefitOption.builder()
                    .name("Divert immediately")
                    .cost(new BigDecimal("5000"))
                    .riskReduction(0)
                    .timeToImplement(10)
                    .successProbability(1.0)
                    .build();

            List<CostBenefitResult> results = costModelService.generateCostBenefitAnalysis(List.of(hold, divert));

            assertThat(results).extracting(result -> result.getOption().getName())
                    .containsExactly("Divert immediately", "Hold and wait");

            CostBenefitResult first = results.get(0);
            assertThat(first.getRiskAdjustedCost()).isEqualByComparingTo("10000");
            assertThat(first.getTotalWeightedCost()).isEqualByComparingTo("10500");
            assertThat(first.getCostPerRiskReduction()).isNull();

            CostBenefitResult second = results.get(1);
            assertThat(second.getExpectedValue()).isEqualByComparingTo("8000");
            assertThat(second.getRiskAdjustedCost()).isEqualByComparingTo("12000");
            assertThat(second.getTimeCost()).isEqualByComparingTo("1500");
            assertThat(second.getTotalWeightedCost()).isEqualByComparingTo("13500");
            assertThat(second.getCostPerRiskReduction()).isEqualByComparingTo("270");
        }

        @Test
        @DisplayName("Should return an empty analysis for no options")
        void generateCostBenefitAnalysis_Empty() {
            assertThat(costModelService.generateCostBenefitAnalysis(List.of())).isEmpty();
            assertThat(costModelService.generateCostBenefitAnalysis(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Insurance Liability Tests")
    class InsuranceTests {

        @Test
        @DisplayName("Should compute coverage, deductible and expected payout")
        void calculateInsuranceLiability_MedicalMajor() {
            InsuranceLiability liability =
                    costModelService.calculateInsuranceLiability(EmergencyType.MEDICAL, IncidentSeverity.MAJOR, 100);

            assertThat(liability.getLiabilityCoverage()).isEqualByComparingTo("20000000");
            assertThat(liability.getDeductible()).isEqualByComparingTo("1500000");
            assertThat(liability.getPotentialClaims()).isEqualTo(30);
            assertThat(liability.getEstimatedPayout()).isEqualByComparingTo("4200000");
        }

        @Test
        @DisplayName("Should allow zero affected passengers")
        void calculateInsuranceLiability_NoPassengers_Zero() {
            InsuranceLiability liability =
                    costModelService.calculateInsuranceLiability(EmergencyType.WEATHER, IncidentSeverity.MINOR, 0);

            assertThat(liability.getLiabilityCoverage()).isEqualByComparingTo("0");
            assertThat(liability.getPotentialClaims()).isZero();
        }

        @Test
        @DisplayName("Should reject negative passengers and missing severity")
        void calculateInsuranceLiability_InvalidInput_ThrowsException() {
            assertThatThrownBy(() -> costModelService.calculateInsuranceLiability(
                    EmergencyType.TECHNICAL, IncidentSeverity.SERIOUS, -1))
                    .isInstanceOf(DiversionValidationException.class);
            assertThatThrownBy(() -> costModelService.calculateInsuranceLiability(EmergencyType.TECHNICAL, null, 10))
                    .isInstanceOf(DiversionValidationException.class);
        }
    }
}
