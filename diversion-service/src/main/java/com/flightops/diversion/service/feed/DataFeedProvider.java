package com.flightops.diversion.service.feed;

import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.DataProvenance;

import java.util.List;
import java.util.Optional;

/**
 * Source of airport weather, NOTAMs and fuel prices.
 * Implementations tag every value they return with {@link #provenance()}.
 */
public interface DataFeedProvider {

    /**
     * @param icao normalised four-character airport code
     * @return current weather, empty when the source has none for the airport
     */
    Optional<WeatherReport> fetchWeather(String icao);

    List<Notam> fetchNotams(String icao);

    Optional<FuelPrice> fetchFuelPrice(String icao);

    DataProvenance provenance();
}
