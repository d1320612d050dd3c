package com.flightops.diversion.service.feed;

import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.FlightConditions;
import com.flightops.diversion.enums.FuelAvailability;
import com.flightops.diversion.enums.NotamStatus;
import com.flightops.diversion.enums.NotamType;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static com.flightops.diversion.constants.DiversionConstants.DEFAULT_CURRENCY;

/**
 * Plausible randomised airport data for demonstration and testing. Every value is tagged SYNTHETIC.
 */
@Component
@ConditionalOnProperty(name = "datafeed.mode", havingValue = "synthetic", matchIfMissing = true)
@Slf4j
public class SyntheticDataFeedProvider implements DataFeedProvider {

    private static final WeatherPattern DEFAULT_PATTERN = new WeatherPattern(8, 1_500, 12);
    private static final Map<String, WeatherPattern> WEATHER_PATTERNS = Map.of(
            "EGLL", new WeatherPattern(8, 1_500, 12),
            "EHAM", new WeatherPattern(6, 1_200, 15),
            "EDDF", new WeatherPattern(9, 1_800, 10),
            "LFPG", new WeatherPattern(7, 1_400, 8),
            "KJFK", new WeatherPattern(10, 2_000, 14),
            "KORD", new WeatherPattern(8, 1_600, 16));

    private static final double DEFAULT_BASE_PRICE = 0.85;
    private static final Map<String, Double> BASE_FUEL_PRICES = Map.of(
            "EGLL", 0.95,
            "EHAM", 0.82,
            "EDDF", 0.87,
            "LFPG", 0.90,
            "KJFK", 0.78,
            "KORD", 0.76);

    private static final List<String> SUPPLIERS = List.of("Shell", "BP", "Total", "ExxonMobil", "Chevron");

    private static final List<NotamTemplate> NOTAM_TEMPLATES = List.of(
            new NotamTemplate(NotamType.RUNWAY, RiskLevel.HIGH, List.of(
                    "Runway 27L closed for maintenance",
                    "Runway 09R reduced width due to construction",
                    "Runway 16/34 intermittent closures for snow clearance")),
            new NotamTemplate(NotamType.EQUIPMENT, RiskLevel.MEDIUM, List.of(
                    "ILS Runway 24 unserviceable",
                    "Ground radar out of service",
                    "ATIS frequency changed temporarily")),
            new NotamTemplate(NotamType.PROCEDURE, RiskLevel.LOW, List.of(
                    "Modified noise abatement procedures in effect",
                    "Special VIP movement restrictions",
                    "Temporary holding pattern changes")));

    private final Random random;
    private final Clock clock;

    public SyntheticDataFeedProvider(@Value("${datafeed.synthetic-seed:0}") long seed, Clock clock) {
        this.random = seed != 0 ? new Random(seed) : new Random();
        this.clock = clock;
        log.info("Initialized SyntheticDataFeedProvider: seeded={}", seed != 0);
    }

    @Override
    public synchronized Optional<WeatherReport> fetchWeather(String icao) {
        WeatherPattern pattern = WEATHER_PATTERNS.getOrDefault(icao, DEFAULT_PATTERN);

        double visibility = Math.max(1, pattern.visibilityKm() + (random.nextDouble() - 0.5) * 4);
        double ceiling = Math.max(200, pattern.ceilingFt() + (random.nextDouble() - 0.5) * 800);
        double windSpeed = Math.max(0, pattern.windKt() + (random.nextDouble() - 0.5) * 10);

        List<String> phenomena = new ArrayList<>();
        if (visibility < 5) {
            phenomena.add("Mist");
        }
        if (ceiling < 500) {
            phenomena.add("Low Cloud");
        }
        if (windSpeed > 20) {
            phenomena.add("Strong Winds");
        }

        return Optional.of(WeatherReport.builder()
                .airport(icao)
                .conditions(conditionsFor(visibility, ceiling))
                .visibility(Math.round(visibility * 10) / 10.0)
                .ceiling((int) Math.round(ceiling))
                .winds(WeatherReport.Winds.builder()
                        .direction(random.nextInt(361))
                        .speed((int) Math.round(windSpeed))
                        .gusts(windSpeed > 15 ? (int) Math.round(windSpeed + 5 + random.nextDouble() * 10) : null)
                        .build())
                .temperature((int) Math.round(15 + (random.nextDouble() - 0.5) * 20))
                .dewpoint((int) Math.round(10 + (random.nextDouble() - 0.5) * 15))
                .qnh((int) Math.round(1013 + (random.nextDouble() - 0.5) * 40))
                .phenomena(phenomena)
                .trend(random.nextDouble() > 0.7 ? "NOSIG" : "BECMG")
                .timestamp(LocalDateTime.now(clock))
                .provenance(DataProvenance.SYNTHETIC)
                .build());
    }

    static FlightConditions conditionsFor(double visibilityKm, double ceilingFt) {
        if (visibilityKm >= 8 && ceilingFt >= 1_500) {
            return FlightConditions.VMC;
        }
        if (visibilityKm >= 5 && ceilingFt >= 1_000) {
            return FlightConditions.MVFR;
        }
        return FlightConditions.IMC;
    }

    @Override
    public synchronized List<Notam> fetchNotams(String icao) {
        LocalDateTime now = LocalDateTime.now(clock);
        int count = random.nextInt(3) + 1;
        List<Notam> notams = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            NotamTemplate template = NOTAM_TEMPLATES.get(random.nextInt(NOTAM_TEMPLATES.size()));
            String description = template.descriptions().get(random.nextInt(template.descriptions().size()));

            notams.add(Notam.builder()
                    .id(String.format("%s%03d", icao, i + 1))
                    .airport(icao)
                    .type(template.type())
                    .description(description)
                    .effective(now.minusMinutes(random.nextInt(24 * 60)))
                    .expires(now.plusMinutes(random.nextInt(7 * 24 * 60) + 1))
                    .status(NotamStatus.ACTIVE)
                    .impact(template.impact())
                    .provenance(DataProvenance.SYNTHETIC)
                    .build());
        }
        return notams;
    }

    @Override
    public synchronized Optional<FuelPrice> fetchFuelPrice(String icao) {
        double basePrice = BASE_FUEL_PRICES.getOrDefault(icao, DEFAULT_BASE_PRICE);
        double marketVariation = (random.nextDouble() - 0.5) * 0.2;

        return Optional.of(FuelPrice.builder()
                .airport(icao)
                .pricePerKg(MoneyUtils.cents(basePrice * (1 + marketVariation)))
                .currency(DEFAULT_CURRENCY)
                .supplier(SUPPLIERS.get(random.nextInt(SUPPLIERS.size())))
                .lastUpdated(LocalDateTime.now(clock))
                .contractRate(random.nextDouble() > 0.3)
                .availability(random.nextDouble() > 0.1 ? FuelAvailability.EXCELLENT : FuelAvailability.GOOD)
                .provenance(DataProvenance.SYNTHETIC)
                .build());
    }

    @Override
    public DataProvenance provenance() {
        return DataProvenance.SYNTHETIC;
    }

    private record WeatherPattern(double visibilityKm, double ceilingFt, double windKt) {
    }

    private record NotamTemplate(NotamType type, RiskLevel impact, List<String> descriptions) {
    }
}
