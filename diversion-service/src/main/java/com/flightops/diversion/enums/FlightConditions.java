package com.flightops.diversion.enums;

/**
 * Meteorological flight conditions reported by the weather feed.
 */
public enum FlightConditions {
    VMC,
    MVFR,
    IMC
}
