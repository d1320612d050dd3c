package com.flightops.diversion.constants;

public final class DiversionConstants {

    private DiversionConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight State ==========

    public static final double DIVERSION_FUEL_RESERVE_FACTOR = 1.10;
    public static final int MINIMUM_LANDING_RESERVE_KG = 3_000;
    public static final int CREW_DIVERSION_BUFFER_MINUTES = 30;
    public static final int CREW_DUTY_LIMITED_MINUTES = 120;
    public static final int CREW_APPROACHING_LIMIT_MINUTES = 60;

    // ========== Scenario Costs ==========

    public static final double SCENARIO_FUEL_PRICE_PER_KG = 0.80;
    public static final int HANDLING_EMERGENCY = 8_000;
    public static final int HANDLING_URGENT = 5_000;
    public static final int HANDLING_STANDARD = 3_000;
    public static final int PASSENGER_COST_MEDIUM_DELAY = 15_000;
    public static final int PASSENGER_COST_LONG_DELAY = 25_000;
    public static final int CREW_COST_LONG_DELAY = 4_000;
    public static final int CREW_COST_MEDIUM_DELAY = 2_000;
    public static final int CREW_COST_SHORT_DELAY = 500;

    // ========== Delay Thresholds (minutes) ==========

    public static final int DELAY_COMPENSATION_THRESHOLD = 180;
    public static final int DELAY_HIGH_COMPENSATION_THRESHOLD = 240;
    public static final int DELAY_SEVERE_THRESHOLD = 300;
    public static final int DELAY_CREW_OVERTIME_THRESHOLD = 120;
    public static final int DELAY_SLOT_LOSS_THRESHOLD = 240;
    public static final int DOWNSTREAM_FLIGHT_INTERVAL_MINUTES = 120;
    public static final double EMERGENCY_RECOVERY_MULTIPLIER = 1.5;

    // ========== Risk Thresholds ==========

    public static final int FUEL_RISK_CRITICAL_KG = 8_000;
    public static final int FUEL_RISK_HIGH_KG = 12_000;
    public static final int FUEL_RISK_MEDIUM_KG = 18_000;
    public static final int CREW_RISK_CRITICAL_MINUTES = 30;
    public static final int CREW_RISK_HIGH_MINUTES = 60;
    public static final int CREW_RISK_MEDIUM_MINUTES = 120;
    public static final int DOWNSTREAM_HIGH_RISK = 3;
    public static final int DOWNSTREAM_MEDIUM_RISK = 1;

    // ========== Disruption Costs ==========

    public static final double OPERATIONAL_OVERHEAD_RATE = 0.20;
    public static final int MEAL_INTERVAL_HOURS = 4;
    public static final int BASE_CREW_SIZE = 12;
    public static final int CREW_OVERTIME_FREE_HOURS = 2;
    public static final int CREW_OVERTIME_HOURLY_RATE = 50;
    public static final int CREW_POSITIONING_DELAY_HOURS = 12;
    public static final int CREW_POSITIONING_COST = 8_000;
    public static final int DIVERSION_BASE_FUEL_KG = 1_500;
    public static final int DIVERSION_HOURLY_FUEL_KG = 200;
    public static final double DISRUPTION_FUEL_PRICE_PER_KG = 0.85;
    public static final int HANDLING_FEE_PER_PASSENGER = 15;

    // ========== Operational Impact ==========

    public static final int AVERAGE_FLIGHT_REVENUE = 180_000;
    public static final double DOWNSTREAM_REVENUE_IMPACT = 0.15;
    public static final int SLOT_LOSS_COST = 25_000;
    public static final int AIRCRAFT_HOURLY_UTILIZATION_COST = 8_500;
    public static final int TIME_COST_PER_MINUTE = 50;

    // ========== Insurance ==========

    public static final double INSURANCE_DEDUCTIBLE_RATE = 0.075;
    public static final double INSURANCE_SETTLEMENT_RATE = 0.70;

    // ========== Customer Impact ==========

    public static final double SCORE_PER_DELAY_MINUTE = 0.5;
    public static final int SCORE_REROUTE = 20;
    public static final int SCORE_MISSED_CONNECTION = 30;
    public static final int SCORE_CAP = 100;
    public static final int COMPENSATION_MEDIUM = 400;
    public static final int COMPENSATION_LONG = 600;

    // ========== Crew ==========

    public static final int CREW_REPLACEMENT_THRESHOLD_MINUTES = 120;
    public static final int LOCAL_CREW_CALLOUT_MINUTES = 180;
    public static final int LOCAL_CREW_CALLOUT_COST = 5_000;
    public static final int POSITIONED_CREW_MINUTES = 360;
    public static final int POSITIONED_CREW_COST = 15_000;
    public static final double FATIGUE_EXTENDED_DUTY_HOURS = 12;
    public static final double FATIGUE_LONG_DUTY_HOURS = 10;
    public static final int FATIGUE_SEGMENT_LIMIT = 4;
    public static final double FATIGUE_MINIMUM_REST_HOURS = 10;
    public static final int CREW_OVERTIME_RATE_PER_HOUR = 120;
    public static final int CREW_POSITIONING_FIXED_COST = 2_500;
    public static final int CREW_REPLACEMENT_FIXED_COST = 8_000;
    public static final int CREW_EXTENDED_DUTY_REPORT_MINUTES = 720;

    // ========== Fuel ==========

    public static final double DEFAULT_FUEL_PRICE_PER_KG = 0.82;
    public static final double ALTITUDE_RESTRICTION_FACTOR = 1.20;
    public static final double CONTINGENCY_FUEL_RATE = 0.05;
    public static final double ALTERNATE_FUEL_RATE = 0.10;
    public static final int FINAL_RESERVE_FUEL_KG = 1_800;
    public static final double HISTORICAL_OVERLOAD_FACTOR = 1.20;
    public static final int SIGNIFICANT_SAVINGS_KG = 2_000;
    public static final int FUEL_MARGIN_CRITICAL_KG = 1_000;
    public static final int FUEL_MARGIN_CAUTION_KG = 2_000;
    public static final int FUEL_MARGIN_MONITOR_KG = 3_000;
    public static final int HIGH_WASTE_KG = 1_000;

    // ========== Data Feeds ==========

    public static final int DEFAULT_FEED_CACHE_TTL_MINUTES = 30;
    public static final String FEED_KIND_WEATHER = "weather";
    public static final String FEED_KIND_NOTAM = "notam";
    public static final String FEED_KIND_FUEL = "fuel";
    public static final String DEFAULT_CURRENCY = "USD";
}
