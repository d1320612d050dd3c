package com.flightops.diversion.service.feed;

import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.FlightConditions;
import com.flightops.diversion.enums.NotamStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SyntheticDataFeedProvider Unit Tests")
class SyntheticDataFeedProviderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    private Clock clock;
    private SyntheticDataFeedProvider provider;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        provider = new SyntheticDataFeedProvider(42L, clock);
    }

    @RepeatedTest(5)
    @DisplayName("Should produce plausible synthetic weather")
    void fetchWeather_Plausible() {
        WeatherReport weather = provider.fetchWeather("EGLL").orElseThrow();

        assertThat(weather.getAirport()).isEqualTo("EGLL");
        assertThat(weather.getProvenance()).isEqualTo(DataProvenance.SYNTHETIC);
        assertThat(weather.getVisibility()).isBetween(1.0, 10.0);
        assertThat(weather.getCeiling()).isBetween(200, 1_900);
        assertThat(weather.getWinds().getDirection()).isBetween(0, 360);
        assertThat(weather.getTimestamp()).isEqualTo(NOW);
        if (weather.getWinds().getGusts() != null) {
            assertThat(weather.getWinds().getGusts()).isGreaterThan(weather.getWinds().getSpeed());
        }
    }

    @RepeatedTest(5)
    @DisplayName("Should produce one to three active NOTAMs")
    void fetchNotams_Plausible() {
        List<Notam> notams = provider.fetchNotams("EHAM");

        assertThat(notams).hasSizeBetween(1, 3);
        assertThat(notams.get(0).getId()).isEqualTo("EHAM001");
        assertThat(notams).allSatisfy(notam -> {
            assertThat(notam.getStatus()).isEqualTo(NotamStatus.ACTIVE);
            assertThat(notam.getProvenance()).isEqualTo(DataProvenance.SYNTHETIC);
            assertThat(notam.getEffective()).isBeforeOrEqualTo(NOW);
            assertThat(notam.getExpires()).isAfter(NOW);
        });
    }

    @RepeatedTest(5)
    @DisplayName("Should price fuel within ten percent of the airport base price")
    void fetchFuelPrice_WithinVariation() {
        FuelPrice price = provider.fetchFuelPrice("EGLL").orElseThrow();

        assertThat(price.getPricePerKg()).isBetween(new BigDecimal("0.85"), new BigDecimal("1.05"));
        assertThat(price.getPricePerKg().scale()).isEqualTo(2);
        assertThat(price.getCurrency()).isEqualTo("USD");
        assertThat(price.getProvenance()).isEqualTo(DataProvenance.SYNTHETIC);
    }

    @Test
    @DisplayName("Should repeat the same sequence for the same seed")
    void fetchWeather_SameSeed_SameSequence() {
        SyntheticDataFeedProvider twin = new SyntheticDataFeedProvider(42L, clock);

        assertThat(twin.fetchWeather("KJFK")).isEqualTo(provider.fetchWeather("KJFK"));
    }

    @Test
    @DisplayName("Should classify flight conditions by visibility and ceiling")
    void conditionsFor_Thresholds() {
        assertThat(SyntheticDataFeedProvider.conditionsFor(8, 1_500)).isEqualTo(FlightConditions.VMC);
        assertThat(SyntheticDataFeedProvider.conditionsFor(7.9, 3_000)).isEqualTo(FlightConditions.MVFR);
        assertThat(SyntheticDataFeedProvider.conditionsFor(10, 999)).isEqualTo(FlightConditions.IMC);
        assertThat(SyntheticDataFeedProvider.conditionsFor(4.9, 3_000)).isEqualTo(FlightConditions.IMC);
    }

    @Test
    @DisplayName("Should report synthetic provenance")
    void provenance_Synthetic() {
        assertThat(provider.provenance()).isEqualTo(DataProvenance.SYNTHETIC);
    }
}
