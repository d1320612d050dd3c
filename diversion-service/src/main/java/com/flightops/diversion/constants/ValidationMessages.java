package com.flightops.diversion.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight Validation Messages ==========

    public static final String FLIGHT_REQUIRED = "Flight state is required";
    public static final String FLIGHT_NUMBER_REQUIRED = "Flight number is required";
    public static final String FLIGHT_TERMINAL = "Flight %s is already %s and cannot be diverted";

    // ========== Scenario Validation Messages ==========

    public static final String SCENARIO_REQUIRED = "Diversion scenario is required";
    public static final String SCENARIO_AIRPORT_REQUIRED = "Diversion airport is required";
    public static final String EMERGENCY_TYPE_REQUIRED = "Emergency type is required";
    public static final String ADVISORY_REQUEST_REQUIRED = "Advisory request is required";

    // ========== Cost Validation Messages ==========

    public static final String PASSENGERS_POSITIVE = "Passenger count must be positive";
    public static final String PASSENGERS_NON_NEGATIVE = "Passenger count must be non-negative";
    public static final String REGION_REQUIRED = "Cost region is required";
    public static final String COST_ESTIMATE_REQUIRED = "Cost estimate is required";
    public static final String INCIDENT_TYPE_REQUIRED = "Incident type and severity are required";

    // ========== Report Validation Messages ==========

    public static final String REPORT_DATA_REQUIRED = "Report data is required";
    public static final String REPORT_SECTION_REQUIRED = "Report data is missing %s";

    // ========== Data Feed Validation Messages ==========

    public static final String ICAO_REQUIRED = "Airport ICAO code is required";
    public static final String ICAO_INVALID = "Invalid airport ICAO code: %s";
}
