package com.flightops.diversion.client;

import com.flightops.diversion.dto.FuelPrice;
import com.flightops.diversion.dto.Notam;
import com.flightops.diversion.dto.WeatherReport;
import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.exception.DataFeedUnavailableException;
import com.flightops.diversion.service.feed.DataFeedProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * REST client for an aviation data feed. Values it returns are tagged AUTHORITATIVE.
 */
@Component
@ConditionalOnProperty(name = "datafeed.mode", havingValue = "live")
@Slf4j
public class AviationDataFeedClient implements DataFeedProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public AviationDataFeedClient(RestTemplate restTemplate,
                                  @Value("${datafeed.base-url:http://localhost:8090/v1/feeds}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        log.info("Initialized AviationDataFeedClient: baseUrl={}", baseUrl);
    }

    @Override
    public Optional<WeatherReport> fetchWeather(String icao) {
        return get("/weather/" + icao, WeatherReport.class, icao)
                .map(weather -> {
                    weather.setProvenance(DataProvenance.AUTHORITATIVE);
                    return weather;
                });
    }

    @Override
    public List<Notam> fetchNotams(String icao) {
        return get("/notams/" + icao, Notam[].class, icao)
                .map(notams -> {
                    for (Notam notam : notams) {
                        notam.setProvenance(DataProvenance.AUTHORITATIVE);
                    }
                    return Arrays.asList(notams);
                })
                .orElseGet(List::of);
    }

    @Override
    public Optional<FuelPrice> fetchFuelPrice(String icao) {
        return get("/fuel/" + icao, FuelPrice.class, icao)
                .map(price -> {
                    price.setProvenance(DataProvenance.AUTHORITATIVE);
                    return price;
                });
    }

    @Override
    public DataProvenance provenance() {
        return DataProvenance.AUTHORITATIVE;
    }

    private <T> Optional<T> get(String path, Class<T> type, String icao) {
        String url = baseUrl + path;
        log.debug("Calling data feed: GET {}", url);

        try {
            ResponseEntity<T> response = restTemplate.getForEntity(url, type);
            log.debug("Data feed response: status={}", response.getStatusCode());
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("No data feed entry: path={}, airport={}", path, icao);
            return Optional.empty();
        } catch (ResourceAccessException e) {
            log.error("Data feed unavailable: {}", e.getMessage(), e);
            throw new DataFeedUnavailableException("Data feed unavailable", e);
        } catch (RestClientException e) {
            log.error("Error calling data feed: type={}, message={}",
                    e.getClass().getName(), e.getMessage(), e);
            throw new DataFeedUnavailableException("Error communicating with data feed", e);
        }
    }
}
