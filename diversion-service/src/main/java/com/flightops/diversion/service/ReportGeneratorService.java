package com.flightops.diversion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightops.diversion.dto.CostEstimate;
import com.flightops.diversion.dto.CustomerImpactScore;
import com.flightops.diversion.dto.DiversionResult;
import com.flightops.diversion.dto.IncidentReportData;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.OperationalAnalysis;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.CustomerImpactCategory;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.exception.ReportGenerationException;
import com.flightops.diversion.util.MoneyUtils;
import com.flightops.diversion.validator.DiversionInputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders diversion outcomes as an occurrence report, an executive summary and a JSON aggregate.
 * Has no side effects beyond logging.
 */
@Service
@Slf4j
public class ReportGeneratorService {

    private static final DateTimeFormatter REPORT_ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter DISPLAY_TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy, HH:mm:ss");
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final String REPORT_TYPE = "Flight Diversion Analysis";
    private static final String REPORT_VERSION = "1.0";

    private static final int BRAND_COST_PER_SCORE_POINT = 1_000;
    private static final int RECOVERY_COST_PER_MINUTE = 100;
    private static final int REGULATORY_COMPLIANCE_COST = 5_000;
    private static final BigDecimal HIGH_COST_THRESHOLD = BigDecimal.valueOf(100_000);
    private static final BigDecimal FINANCIAL_REVIEW_THRESHOLD = BigDecimal.valueOf(50_000);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String preparedBy;

    public ReportGeneratorService(ObjectMapper objectMapper,
                                  Clock clock,
                                  @Value("${report.prepared-by:Diversion Decision Support}") String preparedBy) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.preparedBy = preparedBy;
    }

    // ========== Incident Report ==========

    public String generateIncidentReport(IncidentReportData data) {
        DiversionInputValidator.validateReportData(data);

        LocalDateTime now = LocalDateTime.now(clock);
        DiversionResult result = data.getDiversionResult();
        DiversionResult.RiskAssessment risk = result.getRiskAssessment();
        CustomerImpactScore.Factors factors = data.getCustomerImpact().getFactors();
        CostEstimate cost = data.getCostEstimate();
        String flightNumber = data.getFlight().getFlightNumber();

        StringBuilder report = new StringBuilder();
        report.append("MANDATORY OCCURRENCE REPORT (MOR)\n")
                .append("==================================\n")
                .append("Report ID: MOR-").append(flightNumber).append('-').append(now.format(REPORT_ID_DATE)).append('\n')
                .append("Generated: ").append(now.format(DISPLAY_TIMESTAMP)).append("\n\n");

        section(report, "FLIGHT DETAILS");
        report.append("Flight Number: ").append(flightNumber).append('\n')
                .append("Aircraft Type: ").append(data.getFlight().getAircraftType()).append('\n')
                .append("Origin: ").append(data.getFlight().getOrigin()).append('\n')
                .append("Scheduled Destination: ").append(data.getFlight().getDestination()).append('\n')
                .append("Actual Destination: ").append(result.getDiversionAirport()).append("\n\n")
                .append("ETD: ").append(data.getFlight().getEtd()).append('\n')
                .append("Original ETA: ").append(result.getOriginalEta()).append('\n')
                .append("Actual ETA: ").append(result.getNewEta()).append("\n\n");

        section(report, "DIVERSION DETAILS");
        report.append("Reason: ").append(result.getDiversionReason()).append('\n')
                .append("Decision Time: ").append(now).append('\n')
                .append("Total Delay: ").append(result.getTotalDelay()).append(" minutes\n\n");

        section(report, "AIRCRAFT STATE AT DIVERSION");
        report.append("Fuel Remaining: ").append(String.format(Locale.US, "%,d", result.getFuelRemaining())).append(" kg\n")
                .append("Crew Duty Time Remaining: ").append(result.getCrewTimeRemaining()).append(" minutes\n")
                .append("Aircraft Status: ").append(result.getStatus() != null ? result.getStatus().getLabel() : "")
                .append("\n\n");

        section(report, "OPERATIONAL IMPACT");
        report.append("Passengers Affected: ").append(yesNo(factors.getDelayMinutes() > 0)).append('\n')
                .append("Delay Duration: ").append(factors.getDelayMinutes()).append(" minutes\n")
                .append("Missed Connections: ").append(yesNo(factors.isMissedConnection())).append('\n')
                .append("Rerouting Required: ").append(yesNo(factors.isRerouteRequired())).append("\n\n");

        section(report, "COST ANALYSIS");
        report.append("Direct Costs: ").append(MoneyUtils.format(cost.getTotal())).append('\n')
                .append("- Hotel Accommodation: ").append(MoneyUtils.format(cost.getHotel())).append('\n')
                .append("- Passenger Meals: ").append(MoneyUtils.format(cost.getMeals())).append('\n')
                .append("- Rebooking Costs: ").append(MoneyUtils.format(cost.getRebooking())).append('\n')
                .append("- Crew Costs: ").append(MoneyUtils.format(cost.getBreakdown().getCrewCosts())).append('\n')
                .append("- Fuel Costs: ").append(MoneyUtils.format(cost.getBreakdown().getFuelCosts())).append("\n\n");

        section(report, "CREW STATUS");
        report.append("Crew Legality: ").append(data.getCrewStatus().isLegal() ? "LEGAL" : "EXCEEDED LIMITS").append('\n')
                .append("Safety Margin: ").append(data.getCrewStatus().getSafetyMargin()).append(" minutes\n")
                .append("Risk Level: ").append(upper(data.getCrewStatus().getRiskLevel())).append("\n\n");

        section(report, "FUEL ANALYSIS");
        report.append("Fuel Planning Efficiency: ").append(data.getFuelAnalysis().getEfficiency()).append("%\n")
                .append("Fuel Waste: ").append(String.format(Locale.US, "%,d", data.getFuelAnalysis().getWastedFuel()))
                .append(" kg\n")
                .append("Cost Impact: $").append(data.getFuelAnalysis().getCost().toPlainString()).append("\n\n");

        section(report, "RISK ASSESSMENT");
        report.append("Overall Risk: ").append(upper(risk.getOverall())).append('\n')
                .append("- Fuel Risk: ").append(upper(risk.getFuel())).append('\n')
                .append("- Crew Risk: ").append(upper(risk.getCrew())).append('\n')
                .append("- Operational Risk: ").append(upper(risk.getOperational())).append("\n\n");

        appendFeedConditions(report, data);

        section(report, "LESSONS LEARNED");
        report.append(String.join("\n", lessonsLearned(data))).append("\n\n");

        section(report, "RECOMMENDATIONS");
        report.append(String.join("\n", recommendations(data))).append("\n\n");

        section(report, "REGULATORY NOTIFICATIONS");
        report.append("- CAA Notification: Required\n")
                .append("- Company Safety Department: Notified\n")
                .append("- Insurance Provider: Notified\n")
                .append("- Aircraft Manufacturer: ").append(risk.getOverall() == RiskLevel.CRITICAL ? "Required" : "Not Required")
                .append("\n\n")
                .append("Report Prepared By: ").append(preparedBy).append('\n')
                .append("Reviewed By: [To be completed by Operations Manager]\n")
                .append("Approved By: [To be completed by Chief Pilot]\n\n")
                .append("END OF REPORT\n")
                .append("=============");

        log.info("Incident report generated: flight={}, diversionAirport={}", flightNumber, result.getDiversionAirport());
        return report.toString();
    }

    private void appendFeedConditions(StringBuilder report, IncidentReportData data) {
        WeatherReport weather = data.getWeather();
        List<Notam> notams = data.getNotams() != null ? data.getNotams() : List.of();
        if (weather == null && notams.isEmpty()) {
            return;
        }

        section(report, "CONDITIONS AT DIVERSION AIRPORT");
        if (weather != null) {
            report.append("Weather: ").append(weather.getConditions())
                    .append(String.format(Locale.US, ", visibility %.1f km, ceiling %,d ft",
                            weather.getVisibility(), weather.getCeiling()));
            if (weather.getWinds() != null) {
                report.append(", wind ").append(weather.getWinds().getDirection()).append('/')
                        .append(weather.getWinds().getSpeed());
                if (weather.getWinds().getGusts() != null) {
                    report.append('G').append(weather.getWinds().getGusts());
                }
                report.append("kt");
            }
            report.append(" (").append(weather.getProvenance()).append(")\n");
        }
        if (notams.isEmpty()) {
            report.append("NOTAMs: None reported\n");
        } else {
            report.append("NOTAMs:\n");
            for (Notam notam : notams) {
                report.append("- ").append(notam.getId()).append(": ").append(notam.getDescription())
                        .append(" [").append(upper(notam.getImpact())).append("]\n");
            }
        }
        report.append('\n');
    }

    List<String> lessonsLearned(IncidentReportData data) {
        List<String> lessons = new ArrayList<>();

        if (data.getFuelAnalysis().getEfficiency() < 85) {
            lessons.add("- Fuel planning procedures require review for improved accuracy");
        }
        if (data.getCrewStatus().getRiskLevel() != RiskLevel.LOW) {
            lessons.add("- Crew duty time management needs enhancement");
            lessons.add("- Consider crew rotation policies for extended operations");
        }
        if (data.getCustomerImpact().getScore() > 60) {
            lessons.add("- Customer communication protocols should be reviewed");
            lessons.add("- Passenger care arrangements need improvement");
        }
        if (data.getDiversionResult().getRiskAssessment().getOverall() == RiskLevel.CRITICAL) {
            lessons.add("- Emergency response procedures worked effectively");
            lessons.add("- Decision-making process under pressure was appropriate");
        }

        return lessons.isEmpty() ? List.of("- No significant lessons identified") : lessons;
    }

    List<String> recommendations(IncidentReportData data) {
        List<String> recommendations = new ArrayList<>();

        if (data.getFuelAnalysis().getEfficiency() < 90) {
            recommendations.add("- Implement dynamic fuel planning based on real-time conditions");
        }
        if (data.getCrewStatus().getRiskLevel() != RiskLevel.LOW) {
            recommendations.add("- Review crew scheduling for duty time optimization");
        }
        if (data.getDiversionResult().getOperationalImpact().getDownstreamFlights() > 2) {
            recommendations.add("- Enhance recovery planning for downstream flight impacts");
        }
        if (data.getCostEstimate().getTotal().compareTo(HIGH_COST_THRESHOLD) > 0) {
            recommendations.add("- Review diversion cost mitigation strategies");
        }
        CustomerImpactCategory category = data.getCustomerImpact().getCategory();
        if (category == CustomerImpactCategory.HIGH || category == CustomerImpactCategory.SEVERE) {
            recommendations.add("- Enhance passenger communication during disruptions");
            recommendations.add("- Review compensation and rebooking procedures");
        }

        return recommendations.isEmpty() ? List.of("- Standard procedures followed effectively") : recommendations;
    }

    // ========== Executive Summary ==========

    public String generateExecutiveSummary(IncidentReportData data) {
        DiversionInputValidator.validateReportData(data);

        DiversionResult result = data.getDiversionResult();
        CustomerImpactScore impact = data.getCustomerImpact();

        StringBuilder summary = new StringBuilder();
        summary.append("EXECUTIVE SUMMARY - FLIGHT DIVERSION\n")
                .append("====================================\n\n")
                .append("Flight: ").append(data.getFlight().getFlightNumber())
                .append(" (").append(data.getFlight().getOrigin()).append(" → ")
                .append(data.getFlight().getDestination()).append(")\n")
                .append("Diverted to: ").append(result.getDiversionAirport()).append('\n')
                .append("Date: ").append(LocalDateTime.now(clock).format(DISPLAY_DATE)).append("\n\n");

        section(summary, "KEY METRICS");
        summary.append("• Total Delay: ").append(result.getTotalDelay()).append(" minutes\n")
                .append("• Passengers Affected: Estimate based on delay duration\n")
                .append("• Financial Impact: ").append(MoneyUtils.format(data.getCostEstimate().getTotal())).append('\n')
                .append("• Customer Impact Score: ").append(impact.getScore()).append("/100 (")
                .append(upper(impact.getCategory())).append(")\n\n");

        section(summary, "DECISION RATIONALE");
        summary.append(result.getDiversionReason()).append("\n\n");

        section(summary, "OUTCOME");
        summary.append(outcomeSummary(result.getRiskAssessment().getOverall())).append("\n\n");

        section(summary, "NEXT ACTIONS");
        summary.append(String.join("\n", nextActions(data)));

        return summary.toString();
    }

    private static String outcomeSummary(RiskLevel overall) {
        if (overall == RiskLevel.LOW) {
            return "Diversion executed successfully with minimal operational impact. All safety margins maintained.";
        }
        if (overall == RiskLevel.MEDIUM) {
            return "Diversion completed safely with manageable operational impact. Some recovery actions required.";
        }
        return "Critical diversion executed under challenging conditions. Comprehensive review recommended.";
    }

    private static List<String> nextActions(IncidentReportData data) {
        List<String> actions = new ArrayList<>();
        if (data.getCostEstimate().getTotal().compareTo(FINANCIAL_REVIEW_THRESHOLD) > 0) {
            actions.add("• Financial review and insurance claim processing");
        }
        if (data.getCustomerImpact().getScore() > 50) {
            actions.add("• Customer service follow-up and compensation processing");
        }
        if (data.getCrewStatus().getRiskLevel() != RiskLevel.LOW) {
            actions.add("• Crew scheduling review and potential duty time investigation");
        }
        actions.add("• Complete regulatory notifications within required timeframes");
        return actions;
    }

    // ========== Operational Analysis ==========

    public OperationalAnalysis generateOperationalAnalysis(IncidentReportData data) {
        DiversionInputValidator.validateReportData(data);

        BigDecimal brandImpact = BigDecimal.valueOf((long) data.getCustomerImpact().getScore() * BRAND_COST_PER_SCORE_POINT);
        BigDecimal recovery = BigDecimal.valueOf(
                (long) data.getDiversionResult().getOperationalImpact().getRecoveryTime() * RECOVERY_COST_PER_MINUTE);
        BigDecimal compliance = BigDecimal.valueOf(REGULATORY_COMPLIANCE_COST);

        return OperationalAnalysis.builder()
                .summary(generateExecutiveSummary(data))
                .financialDetail(OperationalAnalysis.FinancialDetail.builder()
                        .directCosts(data.getCostEstimate())
                        .brandImpact(brandImpact)
                        .operationalRecovery(recovery)
                        .regulatoryCompliance(compliance)
                        .totalEstimatedImpact(MoneyUtils.sum(data.getCostEstimate().getTotal(), brandImpact, recovery, compliance))
                        .build())
                .riskAnalysis(OperationalAnalysis.RiskAnalysis.builder()
                        .primaryRisks(primaryRisks(data))
                        .mitigationStrategies(List.of(
                                "Enhanced real-time monitoring systems",
                                "Improved decision support tools",
                                "Better crew resource management",
                                "Advanced weather prediction integration"))
                        .preventionMeasures(List.of(
                                "Predictive analytics for operational disruptions",
                                "Enhanced crew scheduling algorithms",
                                "Improved fuel planning with decision support",
                                "Better passenger communication systems"))
                        .build())
                .recommendations(detailedRecommendations(data))
                .build();
    }

    private static List<String> primaryRisks(IncidentReportData data) {
        DiversionResult.RiskAssessment risk = data.getDiversionResult().getRiskAssessment();
        List<String> risks = new ArrayList<>();
        if (risk.getFuel() != RiskLevel.LOW) {
            risks.add("Fuel management risk: " + risk.getFuel().getCode() + " level");
        }
        if (risk.getCrew() != RiskLevel.LOW) {
            risks.add("Crew duty risk: " + risk.getCrew().getCode() + " level");
        }
        if (data.getCustomerImpact().getScore() > 60) {
            risks.add("High customer satisfaction risk");
        }
        return risks;
    }

    private static List<String> detailedRecommendations(IncidentReportData data) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add("Implement predictive operational analytics");
        recommendations.add("Enhance real-time decision support capabilities");
        recommendations.add("Improve integrated communication systems");
        if (data.getFuelAnalysis().getEfficiency() < 85) {
            recommendations.add("Review and optimize fuel planning procedures");
        }
        if (data.getCrewStatus().getRiskLevel() != RiskLevel.LOW) {
            recommendations.add("Enhance crew resource and duty time management");
        }
        recommendations.add("Strengthen partnership agreements with diversion airports");
        recommendations.add("Enhance passenger care during disruptions");
        return recommendations;
    }

    // ========== JSON Aggregate ==========

    public String generateJsonReport(IncidentReportData data) {
        DiversionInputValidator.validateReportData(data);

        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reportType", REPORT_TYPE);
        metadata.put("generatedAt", now);
        metadata.put("reportId", "RPT-" + data.getFlight().getFlightNumber() + "-" + clock.millis());
        metadata.put("version", REPORT_VERSION);
        metadata.put("preparedBy", preparedBy);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("metadata", metadata);
        report.put("flight", data.getFlight());
        report.put("diversion", data.getDiversionResult());
        report.put("costs", data.getCostEstimate());
        report.put("customerImpact", data.getCustomerImpact());
        report.put("crewStatus", data.getCrewStatus());
        report.put("fuelAnalysis", data.getFuelAnalysis());
        if (data.getWeather() != null) {
            report.put("weather", data.getWeather());
        }
        if (data.getNotams() != null && !data.getNotams().isEmpty()) {
            report.put("notams", data.getNotams());
        }
        report.put("analysis", generateOperationalAnalysis(data));

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise diversion report: flight={}", data.getFlight().getFlightNumber(), e);
            throw new ReportGenerationException("Failed to serialise diversion report", e);
        }
    }

    private static void section(StringBuilder builder, String title) {
        builder.append(title).append('\n').append("-".repeat(title.length())).append('\n');
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    private static String upper(RiskLevel level) {
        return level != null ? level.getCode().toUpperCase(Locale.ROOT) : "UNKNOWN";
    }

    private static String upper(CustomerImpactCategory category) {
        return category != null ? category.getCode().toUpperCase(Locale.ROOT) : "UNKNOWN";
    }
}
