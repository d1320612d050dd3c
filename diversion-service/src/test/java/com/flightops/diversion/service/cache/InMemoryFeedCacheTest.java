package com.flightops.diversion.service.cache;

import com.flightops.diversion.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryFeedCache Unit Tests")
class InMemoryFeedCacheTest {

    private MutableClock clock;
    private InMemoryFeedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        cache = new InMemoryFeedCache(30, clock);
    }

    @Test
    @DisplayName("Should serve an entry until the TTL elapses")
    void get_WithinTtl_ReturnsValue() {
        cache.put("weather", "EGLL", "report");
        clock.advance(Duration.ofMinutes(29));

        assertThat(cache.get("weather", "EGLL")).contains("report");
    }

    @Test
    @DisplayName("Should treat an entry as stale exactly at the TTL")
    void get_AtTtl_Empty() {
        cache.put("weather", "EGLL", "report");
        clock.advance(Duration.ofMinutes(30));

        assertThat(cache.get("weather", "EGLL")).isEmpty();
    }

    @Test
    @DisplayName("Should key entries by kind and airport")
    void get_DifferentKind_Empty() {
        cache.put("weather", "EGLL", "report");

        assertThat(cache.get("fuel", "EGLL")).isEmpty();
        assertThat(cache.get("weather", "EHAM")).isEmpty();
        assertThat(cache.formatKey("weather", "EGLL")).isEqualTo("weather:EGLL");
    }

    @Test
    @DisplayName("Should not store null values")
    void put_Null_Ignored() {
        cache.put("weather", "EGLL", null);

        assertThat(cache.get("weather", "EGLL")).isEmpty();
    }

    @Test
    @DisplayName("Should evict a single entry and clear all entries")
    void evictAndClear() {
        cache.put("weather", "EGLL", "report");
        cache.put("fuel", "EGLL", "price");

        cache.evict("weather", "EGLL");
        assertThat(cache.get("weather", "EGLL")).isEmpty();
        assertThat(cache.get("fuel", "EGLL")).contains("price");

        cache.clear();
        assertThat(cache.get("fuel", "EGLL")).isEmpty();
    }
}
