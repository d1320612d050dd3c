package com.flightops.diversion.service;

import com.flightops.diversion.constants.ValidationMessages;
import com.flightops.diversion.dto.AdvisoryRequest;
import com.flightops.diversion.dto.CostEstimate;
import com.flightops.diversion.dto.CrewLegalityCheck;
import com.flightops.diversion.dto.CustomerImpactScore;
import com.flightops.diversion.dto.DiversionAssessment;
import com.flightops.diversion.dto.DiversionResult;
import com.flightops.diversion.dto.FeasibilityResult;
import com.flightops.diversion.dto.FuelDecisionAnalysis;
import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.IncidentReportData;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.CostRegion;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.exception.DataFeedUnavailableException;
import com.flightops.diversion.exception.DiversionValidationException;
import com.flightops.diversion.mapper.FlightStateMapper;
import com.flightops.diversion.model.DiversionScenario;
import com.flightops.diversion.model.FlightState;
import com.flightops.diversion.validator.DiversionInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.flightops.diversion.constants.DiversionConstants.DEFAULT_FUEL_PRICE_PER_KG;

/**
 * Runs one flight and one candidate diversion through every calculator and renders the reports.
 *
 * <p>Feed outages degrade the assessment rather than fail it: weather and NOTAMs are omitted and
 * fuel is priced at the default rate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiversionAdvisoryService {

    private final ScenarioEngineService scenarioEngineService;
    private final CrewLegalityService crewLegalityService;
    private final CostModelService costModelService;
    private final FuelAnalyticsService fuelAnalyticsService;
    private final ReportGeneratorService reportGeneratorService;
    private final DataFeedService dataFeedService;

    public DiversionAssessment assessDiversion(FlightState flight, DiversionScenario scenario, AdvisoryRequest request) {
        DiversionInputValidator.validateDivertible(flight);
        DiversionInputValidator.validateScenario(scenario);
        if (request == null) {
            throw new DiversionValidationException(ValidationMessages.ADVISORY_REQUEST_REQUIRED);
        }
        DiversionInputValidator.validatePassengerCount(request.getPassengers());

        FeasibilityResult feasibility = scenarioEngineService.validateDiversionFeasibility(flight, scenario);
        CrewLegalityCheck crewLegality = crewLegalityService.checkLegalityStatus(
                flight.getCrewOnDuty(), scenario.getCrewTimeUsed());

        DiversionResult result = scenarioEngineService.simulateDiversion(flight, scenario);

        CostRegion region = request.getRegion() != null ? request.getRegion() : CostRegion.EUROPEAN;
        CostEstimate costEstimate = costModelService.estimateDiversionCost(request.getPassengers(), region,
                request.isOvernightRequired(), result.getTotalDelay() / 60.0);
        CustomerImpactScore customerImpact = costModelService.customerDisruptionScore(
                result.getTotalDelay(), true, request.isMissedConnection());

        String airport = scenario.getAirport();
        Optional<FuelPrice> fuelPrice = fromFeed("fuel price", airport,
                () -> dataFeedService.getFuelPrice(airport), Optional.empty());
        Optional<WeatherReport> weather = fromFeed("weather", airport,
                () -> dataFeedService.getWeather(airport), Optional.empty());
        List<Notam> notams = fromFeed("NOTAMs", airport, () -> dataFeedService.getNotams(airport), List.of());

        double pricePerKg = fuelPrice
                .filter(price -> price.getPricePerKg() != null)
                .map(price -> price.getPricePerKg().doubleValue())
                .orElse(DEFAULT_FUEL_PRICE_PER_KG);
        int requestedExtra = request.getRequestedExtraFuel() > 0
                ? request.getRequestedExtraFuel()
                : scenario.getExtraFuelBurn();
        FuelDecisionAnalysis fuelAnalysis = fuelAnalyticsService.evaluateFuelDecision(
                requestedExtra, scenario.getExtraFuelBurn(), pricePerKg);

        IncidentReportData reportData = IncidentReportData.builder()
                .flight(FlightStateMapper.toEntry(flight))
                .diversionResult(result)
                .costEstimate(costEstimate)
                .customerImpact(customerImpact)
                .crewStatus(crewLegality)
                .fuelAnalysis(fuelAnalysis)
                .weather(weather.orElse(null))
                .notams(notams)
                .build();

        DiversionAssessment assessment = DiversionAssessment.builder()
                .feasibility(feasibility)
                .crewLegality(crewLegality)
                .diversionResult(result)
                .costEstimate(costEstimate)
                .customerImpact(customerImpact)
                .fuelAnalysis(fuelAnalysis)
                .weather(weather.orElse(null))
                .notams(notams)
                .feedProvenance(feedProvenance(fuelPrice, weather, notams))
                .incidentReport(reportGeneratorService.generateIncidentReport(reportData))
                .executiveSummary(reportGeneratorService.generateExecutiveSummary(reportData))
                .jsonReport(reportGeneratorService.generateJsonReport(reportData))
                .build();

        log.info("Diversion assessed: flight={}, airport={}, feasible={}, overallRisk={}",
                flight.getFlightNumber(), airport, feasibility.isFeasible(), result.getRiskAssessment().getOverall());
        return assessment;
    }

    private <T> T fromFeed(String what, String airport, Supplier<T> lookup, T fallback) {
        try {
            return lookup.get();
        } catch (DataFeedUnavailableException e) {
            log.warn("Proceeding without {} for {}: {}", what, airport, e.getMessage());
            return fallback;
        }
    }

    private static DataProvenance feedProvenance(Optional<FuelPrice> fuelPrice, Optional<WeatherReport> weather,
                                                 List<Notam> notams) {
        List<DataProvenance> sources = new ArrayList<>();
        fuelPrice.ifPresent(price -> sources.add(price.getProvenance()));
        weather.ifPresent(report -> sources.add(report.getProvenance()));
        notams.forEach(notam -> sources.add(notam.getProvenance()));
        return DataProvenance.combine(sources.toArray(new DataProvenance[0]));
    }
}
