package com.flightops.diversion.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flightops.diversion.dto.AdvisoryRequest;
import com.flightops.diversion.dto.DiversionAssessment;
import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.CustomerImpactCategory;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.EmergencyType;
import com.flightops.diversion.enums.FlightConditions;
import com.flightops.diversion.enums.FlightStatus;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.exception.DataFeedUnavailableException;
import com.flightops.diversion.exception.DiversionValidationException;
import com.flightops.diversion.model.DiversionScenario;
import com.flightops.diversion.model.FlightState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DiversionAdvisoryService Unit Tests")
class DiversionAdvisoryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private DataFeedService dataFeedService;

    private DiversionAdvisoryService advisoryService;
    private AircraftPerformanceService performanceService;

    private FlightState flight;
    private DiversionScenario heathrow;
    private AdvisoryRequest request;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        ObjectMapper objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        performanceService = new AircraftPerformanceService();
        FuelAnalyticsService fuelAnalyticsService = new FuelAnalyticsService(performanceService);
        CrewLegalityService crewLegalityService = new CrewLegalityService();
        CostModelService costModelService = new CostModelService();
        DiversionScenarioCatalog catalog = new DiversionScenarioCatalog();
        ScenarioEngineService scenarioEngine = new ScenarioEngineService(
                fuelAnalyticsService, crewLegalityService, costModelService, catalog, clock);

        advisoryService = new DiversionAdvisoryService(
                scenarioEngine,
                crewLegalityService,
                costModelService,
                fuelAnalyticsService,
                new ReportGeneratorService(objectMapper, clock, "Ops Control Desk"),
                dataFeedService);

        flight = FlightState.builder()
                .flightNumber("BA117")
                .origin("EGLL")
                .destination("KJFK")
                .aircraftType("B787")
                .crewOnDuty(300)
                .fuelOnBoard(40_000)
                .etd(NOW.minusHours(1))
                .eta(NOW.minusMinutes(5))
                .status(FlightStatus.EN_ROUTE)
                .build();
        heathrow = catalog.candidatesFor(EmergencyType.MEDICAL).get(0);
        request = AdvisoryRequest.builder()
                .passengers(200)
                .requestedExtraFuel(4_000)
                .build();
    }

    private void feedsAvailable() {
        when(dataFeedService.getFuelPrice("EGLL")).thenReturn(Optional.of(FuelPrice.builder()
                .airport("EGLL")
                .pricePerKg(new BigDecimal("1.00"))
                .provenance(DataProvenance.SYNTHETIC)
                .build()));
        when(dataFeedService.getWeather("EGLL")).thenReturn(Optional.of(WeatherReport.builder()
                .airport("EGLL")
                .conditions(FlightConditions.VMC)
                .visibility(10)
                .ceiling(3_000)
                .provenance(DataProvenance.SYNTHETIC)
                .build()));
        when(dataFeedService.getNotams("EGLL")).thenReturn(List.of(Notam.builder()
                .id("EGLL001")
                .description("ILS Runway 24 unserviceable")
                .impact(RiskLevel.MEDIUM)
                .provenance(DataProvenance.SYNTHETIC)
                .build()));
    }

    private void feedsUnavailable() {
        DataFeedUnavailableException outage = new DataFeedUnavailableException("Data feed unavailable");
        when(dataFeedService.getFuelPrice(anyString())).thenThrow(outage);
        when(dataFeedService.getWeather(anyString())).thenThrow(outage);
        when(dataFeedService.getNotams(anyString())).thenThrow(outage);
    }

    @Nested
    @DisplayName("Assessment Tests")
    class AssessmentTests {

        @Test
        @DisplayName("Should assemble a full assessment from every calculator")
        void assessDiversion_FeedsAvailable_FullAssessment() {
            feedsAvailable();

            DiversionAssessment assessment = advisoryService.assessDiversion(flight, heathrow, request);

            assertThat(assessment.getFeasibility().isFeasible()).isTrue();
            assertThat(assessment.getCrewLegality().isLegal()).isTrue();
            assertThat(assessment.getCrewLegality().getSafetyMargin()).isEqualTo(255);
            assertThat(assessment.getDiversionResult().getTotalDelay()).isEqualTo(30);
            assertThat(assessment.getCostEstimate().getTotal()).isEqualByComparingTo("88260");
            assertThat(assessment.getCustomerImpact().getScore()).isEqualTo(35);
            assertThat(assessment.getCustomerImpact().getCategory()).isEqualTo(CustomerImpactCategory.MODERATE);
            assertThat(assessment.getFuelAnalysis().getWastedFuel()).isEqualTo(1_200);
            assertThat(assessment.getFuelAnalysis().getCost()).isEqualByComparingTo("1200.00");
            assertThat(assessment.getWeather()).isNotNull();
            assertThat(assessment.getNotams()).hasSize(1);
            assertThat(assessment.getFeedProvenance()).isEqualTo(DataProvenance.SYNTHETIC);
        }

        @Test
        @DisplayName("Should render reports for the diverted flight")
        void assessDiversion_Reports() {
            feedsAvailable();

            DiversionAssessment assessment = advisoryService.assessDiversion(flight, heathrow, request);

            assertThat(flight.getStatus()).isEqualTo(FlightStatus.DIVERTED);
            assertThat(assessment.getIncidentReport())
                    .contains("Report ID: MOR-BA117-20240501")
                    .contains("Actual Destination: EGLL")
                    .contains("- EGLL001: ILS Runway 24 unserviceable [MEDIUM]");
            assertThat(assessment.getExecutiveSummary()).contains("Diverted to: EGLL");
            assertThat(assessment.getJsonReport()).contains("\"reportType\" : \"Flight Diversion Analysis\"");
        }

        @Test
        @DisplayName("Should use the scenario burn when no extra fuel was requested")
        void assessDiversion_NoRequestedFuel_NoWaste() {
            feedsAvailable();
            request.setRequestedExtraFuel(0);

            DiversionAssessment assessment = advisoryService.assessDiversion(flight, heathrow, request);

            assertThat(assessment.getFuelAnalysis().getRequestedExtra()).isEqualTo(2_800);
            assertThat(assessment.getFuelAnalysis().getWastedFuel()).isZero();
            assertThat(assessment.getFuelAnalysis().getEfficiency()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Feed Outage Tests")
    class FeedOutageTests {

        @Test
        @DisplayName("Should fall back to the default fuel price when feeds are down")
        void assessDiversion_FeedsDown_DefaultPrice() {
            feedsUnavailable();

            DiversionAssessment assessment = advisoryService.assessDiversion(flight, heathrow, request);

            assertThat(assessment.getFuelAnalysis().getCost()).isEqualByComparingTo("984.00");
            assertThat(assessment.getWeather()).isNull();
            assertThat(assessment.getNotams()).isEmpty();
            assertThat(assessment.getFeedProvenance()).isNull();
            assertThat(assessment.getIncidentReport()).doesNotContain("CONDITIONS AT DIVERSION AIRPORT");
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a missing request before touching the flight")
        void assessDiversion_NullRequest_ThrowsException() {
            assertThatThrownBy(() -> advisoryService.assessDiversion(flight, heathrow, null))
                    .isInstanceOf(DiversionValidationException.class)
                    .hasMessage("Advisory request is required");

            assertThat(flight.getStatus()).isEqualTo(FlightStatus.EN_ROUTE);
            verifyNoInteractions(dataFeedService);
        }

        @Test
        @DisplayName("Should reject a request without passengers")
        void assessDiversion_NoPassengers_ThrowsException() {
            request.setPassengers(0);

            assertThatThrownBy(() -> advisoryService.assessDiversion(flight, heathrow, request))
                    .isInstanceOf(DiversionValidationException.class);
            assertThat(flight.getFuelOnBoard()).isEqualTo(40_000);
        }

        @Test
        @DisplayName("Should reject a cancelled flight")
        void assessDiversion_CancelledFlight_ThrowsException() {
            flight.updateStatus(FlightStatus.CANCELLED);

            assertThatThrownBy(() -> advisoryService.assessDiversion(flight, heathrow, request))
                    .isInstanceOf(DiversionValidationException.class)
                    .hasMessage("Flight BA117 is already Cancelled and cannot be diverted");
        }
    }
}
