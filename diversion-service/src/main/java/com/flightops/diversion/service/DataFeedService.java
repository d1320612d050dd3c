package com.flightops.diversion.service;

import com.flightops.diversion.dto.AirportOperationalData;
import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.OperationalAlert;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.AlertSeverity;
import com.flightops.diversion.enums.AlertType;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.FlightConditions;
import com.flightops.diversion.enums.FuelAvailability;
import com.flightops.diversion.enums.RiskLevel;
import com.flightops.diversion.service.cache.FeedCacheOperations;
import com.flightops.diversion.service.feed.DataFeedProvider;
import com.flightops.diversion.validator.DiversionInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

import static com.flightops.diversion.constants.DiversionConstants.FEED_KIND_FUEL;
import static com.flightops.diversion.constants.DiversionConstants.FEED_KIND_NOTAM;
import static com.flightops.diversion.constants.DiversionConstants.FEED_KIND_WEATHER;

/**
 * Read-through cached access to airport weather, NOTAMs and fuel prices.
 *
 * <p>Provider failures propagate as {@link com.flightops.diversion.exception.DataFeedUnavailableException};
 * nothing is cached for a failed or empty lookup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataFeedService {

    private static final int STRONG_WIND_KT = 25;
    private static final BigDecimal HIGH_FUEL_PRICE_PER_KG = BigDecimal.ONE;

    private final DataFeedProvider provider;
    private final FeedCacheOperations cache;

    // ========== Queries ==========

    public Optional<WeatherReport> getWeather(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        return readThrough(FEED_KIND_WEATHER, airport, WeatherReport.class, () -> provider.fetchWeather(airport).orElse(null));
    }

    public List<Notam> getNotams(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        return readThrough(FEED_KIND_NOTAM, airport, Notam[].class, () -> {
            List<Notam> fetched = provider.fetchNotams(airport);
            return fetched == null || fetched.isEmpty() ? null : fetched.toArray(new Notam[0]);
        }).map(notams -> List.of(notams)).orElse(List.of());
    }

    public Optional<FuelPrice> getFuelPrice(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        return readThrough(FEED_KIND_FUEL, airport, FuelPrice.class, () -> provider.fetchFuelPrice(airport).orElse(null));
    }

    public DataProvenance getProvenance() {
        return provider.provenance();
    }

    public void invalidate(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        cache.evict(FEED_KIND_WEATHER, airport);
        cache.evict(FEED_KIND_NOTAM, airport);
        cache.evict(FEED_KIND_FUEL, airport);
        log.debug("Feed cache invalidated: airport={}", airport);
    }

    private <T> Optional<T> readThrough(String kind, String icao, Class<T> type, Supplier<T> loader) {
        Optional<T> cached = cache.get(kind, icao)
                .filter(type::isInstance)
                .map(type::cast);
        if (cached.isPresent()) {
            log.debug("Feed cache hit: kind={}, airport={}", kind, icao);
            return cached;
        }

        T loaded = loader.get();
        if (loaded != null) {
            cache.put(kind, icao, loaded);
        }
        return Optional.ofNullable(loaded);
    }

    // ========== Aggregates ==========

    public AirportOperationalData getAirportOperationalData(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        WeatherReport weather = getWeather(airport).orElse(null);
        List<Notam> notams = getNotams(airport);
        FuelPrice fuelPrice = getFuelPrice(airport).orElse(null);

        List<DataProvenance> sources = new ArrayList<>();
        if (weather != null) {
            sources.add(weather.getProvenance());
        }
        notams.forEach(notam -> sources.add(notam.getProvenance()));
        if (fuelPrice != null) {
            sources.add(fuelPrice.getProvenance());
        }
        DataProvenance provenance = DataProvenance.combine(sources.toArray(new DataProvenance[0]));
        if (provenance == DataProvenance.MIXED) {
            log.warn("Airport data combines authoritative and synthetic sources: airport={}", airport);
        }

        return AirportOperationalData.builder()
                .airport(airport)
                .weather(weather)
                .notams(notams)
                .fuelPrice(fuelPrice)
                .summary(operationalSummary(airport, weather, notams, fuelPrice))
                .provenance(provenance)
                .build();
    }

    String operationalSummary(String airport, WeatherReport weather, List<Notam> notams, FuelPrice fuelPrice) {
        StringBuilder summary = new StringBuilder(airport).append(": ");

        if (weather == null) {
            summary.append("Weather unavailable. ");
        } else {
            summary.append(conditionsText(weather.getConditions())).append(". ");
            WeatherReport.Winds winds = weather.getWinds();
            if (winds != null) {
                summary.append("Winds ").append(winds.getDirection()).append("°/").append(winds.getSpeed());
                if (winds.getGusts() != null) {
                    summary.append('G').append(winds.getGusts());
                }
                summary.append("kt. ");
            }
        }

        summary.append(notams.isEmpty() ? "No significant NOTAMs" : notams.size() + " active NOTAMs").append('.');

        if (fuelPrice != null) {
            summary.append(" Fuel: $").append(fuelPrice.getPricePerKg().toPlainString()).append("/kg");
            if (fuelPrice.getSupplier() != null) {
                summary.append(" (").append(fuelPrice.getSupplier()).append(')');
            }
            summary.append('.');
        }
        return summary.toString();
    }

    private static String conditionsText(FlightConditions conditions) {
        if (conditions == FlightConditions.VMC) {
            return "Good visual conditions";
        }
        if (conditions == FlightConditions.MVFR) {
            return "Marginal visual conditions";
        }
        return "Instrument conditions";
    }

    public List<OperationalAlert> getOperationalAlerts(String icao) {
        String airport = DiversionInputValidator.validateIcao(icao);
        List<OperationalAlert> alerts = new ArrayList<>();

        getWeather(airport).ifPresent(weather -> {
            if (weather.getConditions() == FlightConditions.IMC) {
                alerts.add(alert(AlertType.WEATHER, AlertSeverity.WARNING,
                        "Poor weather conditions at " + airport + " - IFR approaches required", weather.getProvenance()));
            }
            if (weather.getWinds() != null && weather.getWinds().getSpeed() > STRONG_WIND_KT) {
                alerts.add(alert(AlertType.WEATHER, AlertSeverity.WARNING,
                        "Strong winds at " + airport + " - " + weather.getWinds().getSpeed() + "kt", weather.getProvenance()));
            }
        });

        List<Notam> critical = getNotams(airport).stream()
                .filter(notam -> notam.getImpact() != null && notam.getImpact().isAtLeast(RiskLevel.HIGH))
                .toList();
        if (!critical.isEmpty()) {
            alerts.add(alert(AlertType.NOTAM, AlertSeverity.CRITICAL,
                    String.format(Locale.US, "%d critical NOTAMs active at %s", critical.size(), airport),
                    critical.get(0).getProvenance()));
        }

        getFuelPrice(airport).ifPresent(fuel -> {
            if (fuel.getAvailability() == FuelAvailability.LIMITED) {
                alerts.add(alert(AlertType.FUEL, AlertSeverity.WARNING,
                        "Limited fuel availability at " + airport, fuel.getProvenance()));
            }
            if (fuel.getPricePerKg() != null && fuel.getPricePerKg().compareTo(HIGH_FUEL_PRICE_PER_KG) > 0) {
                alerts.add(alert(AlertType.FUEL, AlertSeverity.INFO,
                        "High fuel prices at " + airport + " - $" + fuel.getPricePerKg().toPlainString() + "/kg",
                        fuel.getProvenance()));
            }
        });

        if (!alerts.isEmpty()) {
            log.info("Operational alerts raised: airport={}, count={}", airport, alerts.size());
        }
        return alerts;
    }

    private static OperationalAlert alert(AlertType type, AlertSeverity severity, String message,
                                          DataProvenance provenance) {
        return OperationalAlert.builder()
                .type(type)
                .severity(severity)
                .message(message)
                .provenance(provenance)
                .build();
    }
}
