package com.flightops.diversion.service.cache;

import java.util.Optional;

/**
 * Cache for data feed values, keyed by feed kind and airport.
 * Entries older than the staleness window are never returned.
 */
public interface FeedCacheOperations {

    Optional<Object> get(String kind, String icao);

    void put(String kind, String icao, Object value);

    void evict(String kind, String icao);

    void clear();

    default String formatKey(String kind, String icao) {
        return kind + ":" + icao;
    }
}
