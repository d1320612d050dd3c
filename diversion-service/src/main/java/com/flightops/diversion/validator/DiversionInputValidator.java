package com.flightops.diversion.validator;

import com.flightops.diversion.constants.ValidationMessages;
import com.flightops.diversion.dto.IncidentReportData;
import com.flightops.diversion.enums.CostRegion;
import com.flightops.diversion.exception.DiversionValidationException;
import com.flightops.diversion.model.DiversionScenario;
import com.flightops.diversion.model.FlightState;
import com.flightops.diversion.util.StringUtils;

import java.util.regex.Pattern;

public final class DiversionInputValidator {

    private static final Pattern ICAO_PATTERN = Pattern.compile("^[A-Z0-9]{4}$");

    private DiversionInputValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlight(FlightState flight) {
        if (flight == null) {
            throw new DiversionValidationException(ValidationMessages.FLIGHT_REQUIRED);
        }
        if (!org.springframework.util.StringUtils.hasText(flight.getFlightNumber())) {
            throw new DiversionValidationException(ValidationMessages.FLIGHT_NUMBER_REQUIRED);
        }
    }

    public static void validateScenario(DiversionScenario scenario) {
        if (scenario == null) {
            throw new DiversionValidationException(ValidationMessages.SCENARIO_REQUIRED);
        }
        if (!org.springframework.util.StringUtils.hasText(scenario.getAirport())) {
            throw new DiversionValidationException(ValidationMessages.SCENARIO_AIRPORT_REQUIRED);
        }
    }

    /**
     * A flight that already arrived or was cancelled cannot be diverted.
     */
    public static void validateDivertible(FlightState flight) {
        validateFlight(flight);
        if (flight.isTerminal()) {
            throw new DiversionValidationException(String.format(ValidationMessages.FLIGHT_TERMINAL,
                    flight.getFlightNumber(), flight.getStatus().getLabel()));
        }
    }

    public static void validatePassengerCount(int passengers) {
        if (passengers <= 0) {
            throw new DiversionValidationException(ValidationMessages.PASSENGERS_POSITIVE);
        }
    }

    public static void validateAffectedPassengers(int passengers) {
        if (passengers < 0) {
            throw new DiversionValidationException(ValidationMessages.PASSENGERS_NON_NEGATIVE);
        }
    }

    public static void validateRegion(CostRegion region) {
        if (region == null) {
            throw new DiversionValidationException(ValidationMessages.REGION_REQUIRED);
        }
    }

    /**
     * @return the code trimmed and upper-cased
     */
    public static String validateIcao(String icao) {
        String normalized = StringUtils.normalizeCode(icao);
        if (normalized == null) {
            throw new DiversionValidationException(ValidationMessages.ICAO_REQUIRED);
        }
        if (!ICAO_PATTERN.matcher(normalized).matches()) {
            throw new DiversionValidationException(String.format(ValidationMessages.ICAO_INVALID, icao));
        }
        return normalized;
    }

    public static void validateReportData(IncidentReportData data) {
        if (data == null) {
            throw new DiversionValidationException(ValidationMessages.REPORT_DATA_REQUIRED);
        }
        requireSection(data.getFlight(), "flight");
        requireSection(data.getDiversionResult(), "diversion result");
        requireSection(data.getCostEstimate(), "cost estimate");
        requireSection(data.getCustomerImpact(), "customer impact");
        requireSection(data.getCrewStatus(), "crew status");
        requireSection(data.getFuelAnalysis(), "fuel analysis");
    }

    private static void requireSection(Object section, String name) {
        if (section == null) {
            throw new DiversionValidationException(String.format(ValidationMessages.REPORT_SECTION_REQUIRED, name));
        }
    }
}
