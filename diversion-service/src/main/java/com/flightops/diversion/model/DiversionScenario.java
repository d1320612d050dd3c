package com.flightops.diversion.model;

import com.flightops.diversion.enums.FacilitiesRating;
import com.flightops.diversion.enums.Urgency;
import com.flightops.diversion.enums.WeatherSuitability;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A candidate diversion. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DiversionScenario {

    String airport;
    String airportName;

    /** Great-circle distance to the diversion airport in km. */
    int distance;

    /** Minutes from now until landing at the diversion airport. */
    int estimatedFlightTime;

    int extraFuelBurn;
    int crewTimeUsed;
    String reason;
    Urgency urgency;
    WeatherSuitability weatherSuitability;
    FacilitiesRating facilitiesRating;
}
