package com.flightops.diversion.service;

import com.flightops.diversion.dto.CrewCostBreakdown;
import com.flightops.diversion.dto.CrewCostScenario;
import com.flightops.diversion.dto.CrewFatigueAssessment;
import com.flightops.diversion.dto.CrewLegalityCheck;
import com.flightops.diversion.dto.CrewMemberDuty;
import com.flightops.diversion.dto.CrewReplacementPlan;
import com.flightops.diversion.enums.CostRegion;
import com.flightops.diversion.enums.ExtensionType;
import com.flightops.diversion.enums.FatigueLevel;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static com.flightops.diversion.constants.DiversionConstants.CREW_EXTENDED_DUTY_REPORT_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_OVERTIME_RATE_PER_HOUR;
import static com.flightops.diversion.constants.DiversionConstants.CREW_POSITIONING_FIXED_COST;
import static com.flightops.diversion.constants.DiversionConstants.CREW_REPLACEMENT_FIXED_COST;
import static com.flightops.diversion.constants.DiversionConstants.CREW_REPLACEMENT_THRESHOLD_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_RISK_CRITICAL_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_RISK_HIGH_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_RISK_MEDIUM_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.FATIGUE_EXTENDED_DUTY_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.FATIGUE_LONG_DUTY_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.FATIGUE_MINIMUM_REST_HOURS;
import static com.flightops.diversion.constants.DiversionConstants.FATIGUE_SEGMENT_LIMIT;
import static com.flightops.diversion.constants.DiversionConstants.LOCAL_CREW_CALLOUT_COST;
import static com.flightops.diversion.constants.DiversionConstants.LOCAL_CREW_CALLOUT_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.POSITIONED_CREW_COST;
import static com.flightops.diversion.constants.DiversionConstants.POSITIONED_CREW_MINUTES;

/**
 * Crew duty legality, replacement and fatigue calculators.
 *
 * <p>Extension limits follow a simplified flight time limitation scheme and are not a certified
 * implementation of any regulator's rules.
 */
@Service
@Slf4j
public class CrewLegalityService {

    private static final Map<CostRegion, Integer> ACCOMMODATION_NIGHTLY = new EnumMap<>(CostRegion.class);

    static {
        ACCOMMODATION_NIGHTLY.put(CostRegion.DOMESTIC, 150);
        ACCOMMODATION_NIGHTLY.put(CostRegion.EUROPEAN, 200);
        ACCOMMODATION_NIGHTLY.put(CostRegion.LONGHAUL, 300);
    }

    // ========== Legality ==========

    public boolean isCrewLegal(int minutesRemaining, int requiredMinutes) {
        return minutesRemaining >= requiredMinutes;
    }

    public CrewLegalityCheck checkLegalityStatus(int minutesRemaining, int scenarioExtension) {
        int safetyMargin = minutesRemaining - scenarioExtension;
        RiskLevel riskLevel = riskForRemainingMinutes(safetyMargin);
        List<String> recommendations = new ArrayList<>(marginRecommendations(riskLevel));

        ExtensionType extensionType = null;
        if (scenarioExtension > 0) {
            extensionType = ExtensionType.forExtension(scenarioExtension);
            recommendations.add("Extension required: " + extensionType.getDescription());
            if (extensionType == ExtensionType.NOT_PERMITTED) {
                riskLevel = RiskLevel.CRITICAL;
                recommendations.add("Extension exceeds regulatory limits");
            }
        }

        CrewLegalityCheck check = CrewLegalityCheck.builder()
                .legal(isCrewLegal(minutesRemaining, scenarioExtension))
                .timeRemaining(minutesRemaining)
                .requiredTime(scenarioExtension)
                .safetyMargin(safetyMargin)
                .recommendations(recommendations)
                .riskLevel(riskLevel)
                .extensionType(extensionType)
                .build();

        log.debug("Crew legality checked: remaining={}, required={}, legal={}, risk={}",
                minutesRemaining, scenarioExtension, check.isLegal(), riskLevel);
        return check;
    }

    /**
     * Crew axis of a diversion risk assessment, graded on minutes of duty left.
     */
    public RiskLevel riskForRemainingMinutes(int minutes) {
        if (minutes < CREW_RISK_CRITICAL_MINUTES) {
            return RiskLevel.CRITICAL;
        }
        if (minutes < CREW_RISK_HIGH_MINUTES) {
            return RiskLevel.HIGH;
        }
        if (minutes < CREW_RISK_MEDIUM_MINUTES) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    // ========== Replacement ==========

    public CrewReplacementPlan calculateCrewReplacement(String currentLocation, String diversionAirport,
                                                        int remainingDutyMinutes) {
        if (remainingDutyMinutes >= CREW_REPLACEMENT_THRESHOLD_MINUTES) {
            return CrewReplacementPlan.builder()
                    .required(false)
                    .estimatedTime(0)
                    .cost(BigDecimal.ZERO)
                    .build();
        }

        List<String> logistics = new ArrayList<>();
        int estimatedTime;
        int cost;
        if (Objects.equals(currentLocation, diversionAirport)) {
            estimatedTime = LOCAL_CREW_CALLOUT_MINUTES;
            cost = LOCAL_CREW_CALLOUT_COST;
            logistics.add("Contact local crew scheduling");
            logistics.add("Arrange crew transportation to aircraft");
        } else {
            estimatedTime = POSITIONED_CREW_MINUTES;
            cost = POSITIONED_CREW_COST;
            logistics.add("Position replacement crew from base");
            logistics.add("Arrange crew transportation and accommodation");
            logistics.add("Coordinate with crew scheduling and operations");
        }
        logistics.add("Arrange passenger accommodation if overnight");
        logistics.add("Notify maintenance for extended ground time");

        log.info("Crew replacement required: location={}, diversionAirport={}, remaining={}",
                currentLocation, diversionAirport, remainingDutyMinutes);

        return CrewReplacementPlan.builder()
                .required(true)
                .estimatedTime(estimatedTime)
                .cost(BigDecimal.valueOf(cost))
                .logistics(logistics)
                .build();
    }

    // ========== Fatigue ==========

    /**
     * Advisory grading from duty length, sectors flown and the last rest period.
     */
    public CrewFatigueAssessment assessCrewFatigue(LocalDateTime dutyStart, LocalDateTime now,
                                                   int flightSegments, double lastRestHours) {
        double dutyHours = Duration.between(dutyStart, now).toMinutes() / 60.0;
        List<String> indicators = new ArrayList<>();
        FatigueLevel level = FatigueLevel.LOW;

        if (dutyHours > FATIGUE_EXTENDED_DUTY_HOURS) {
            level = FatigueLevel.HIGH;
            indicators.add(String.format(Locale.US, "Extended duty time: %.1f hours", dutyHours));
        } else if (dutyHours > FATIGUE_LONG_DUTY_HOURS) {
            level = FatigueLevel.MODERATE;
            indicators.add(String.format(Locale.US, "Long duty period: %.1f hours", dutyHours));
        }

        if (flightSegments > FATIGUE_SEGMENT_LIMIT) {
            indicators.add("Multiple sectors: " + flightSegments + " flights");
            level = level.escalate();
        }

        if (lastRestHours < FATIGUE_MINIMUM_REST_HOURS) {
            indicators.add(String.format(Locale.US, "Reduced rest: %s hours", formatHours(lastRestHours)));
            level = level.escalate();
        }

        List<String> recommendations = new ArrayList<>();
        if (level == FatigueLevel.HIGH) {
            recommendations.add("Consider crew replacement");
            recommendations.add("Monitor crew performance closely");
            recommendations.add("Minimize non-essential workload");
        } else if (level == FatigueLevel.MODERATE) {
            recommendations.add("Monitor crew alertness");
            recommendations.add("Consider controlled rest if possible");
        }

        return CrewFatigueAssessment.builder()
                .fatigueLevel(level)
                .dutyHours(Math.round(dutyHours * 10) / 10.0)
                .indicators(indicators)
                .recommendations(recommendations)
                .build();
    }

    // ========== Costs & Reporting ==========

    public CrewCostBreakdown calculateCrewCosts(CrewCostScenario scenario) {
        CostRegion location = scenario.getLocation() != null ? scenario.getLocation() : CostRegion.EUROPEAN;

        BigDecimal overtime = MoneyUtils.cents(scenario.getOvertimeHours() * CREW_OVERTIME_RATE_PER_HOUR);
        BigDecimal accommodation = BigDecimal.valueOf(
                (long) scenario.getAccommodationNights() * ACCOMMODATION_NIGHTLY.get(location));
        BigDecimal positioning = scenario.isPositioning()
                ? BigDecimal.valueOf(CREW_POSITIONING_FIXED_COST) : BigDecimal.ZERO;
        BigDecimal replacement = scenario.isReplacement()
                ? BigDecimal.valueOf(CREW_REPLACEMENT_FIXED_COST) : BigDecimal.ZERO;

        return CrewCostBreakdown.builder()
                .overtime(overtime)
                .accommodation(accommodation)
                .positioning(positioning)
                .replacement(replacement)
                .total(MoneyUtils.sum(overtime, accommodation, positioning, replacement))
                .build();
    }

    public String generateCrewDutyReport(String flightNumber, List<CrewMemberDuty> crew) {
        List<String> lines = new ArrayList<>();
        lines.add("Crew Duty Report - Flight " + flightNumber);
        lines.add("=".repeat(50));

        int maxDuty = 0;
        int totalExtensions = 0;
        for (CrewMemberDuty member : crew) {
            lines.add(member.getPosition() + ": " + member.getName());
            lines.add("  Duty Start: " + member.getDutyStart());
            lines.add("  Current Duty: " + formatDuration(member.getCurrentDuty()));
            lines.add("  Extensions Used: " + member.getExtensionsUsed() + " minutes");
            lines.add("");
            maxDuty = Math.max(maxDuty, member.getCurrentDuty());
            totalExtensions += member.getExtensionsUsed();
        }

        lines.add("Summary:");
        lines.add("  Maximum Duty Time: " + formatDuration(maxDuty));
        lines.add("  Total Extensions: " + totalExtensions + " minutes");
        lines.add(maxDuty > CREW_EXTENDED_DUTY_REPORT_MINUTES
                ? "  STATUS: CAUTION - Extended duty time"
                : "  STATUS: Normal operations");

        return String.join("\n", lines);
    }

    private static List<String> marginRecommendations(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case CRITICAL -> List.of("CRITICAL: Crew approaching maximum duty limits",
                    "Consider crew replacement or immediate landing");
            case HIGH -> List.of("HIGH RISK: Very limited crew time remaining",
                    "Minimize delays and prepare for expedited operations");
            case MEDIUM -> List.of("CAUTION: Monitor crew duty time closely", "Avoid unnecessary delays");
            case LOW -> List.of("Crew duty time within normal limits");
        };
    }

    private static String formatDuration(int minutes) {
        return (minutes / 60) + "h " + (minutes % 60) + "m";
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }
}
