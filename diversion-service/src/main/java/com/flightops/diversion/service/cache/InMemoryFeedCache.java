package com.flightops.diversion.service.cache;

import com.flightops.diversion.constants.DiversionConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local feed cache with a fixed staleness window.
 */
@Component
@Slf4j
public class InMemoryFeedCache implements FeedCacheOperations {

    private final Map<String, CachedValue> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryFeedCache(
            @Value("${datafeed.cache-ttl-minutes:" + DiversionConstants.DEFAULT_FEED_CACHE_TTL_MINUTES + "}") long ttlMinutes,
            Clock clock) {
        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String kind, String icao) {
        String key = formatKey(kind, icao);
        CachedValue cached = entries.get(key);
        if (cached == null) {
            return Optional.empty();
        }

        if (isStale(cached)) {
            entries.remove(key, cached);
            log.debug("Evicted stale feed entry: key={}, storedAt={}", key, cached.storedAt());
            return Optional.empty();
        }
        return Optional.of(cached.value());
    }

    @Override
    public void put(String kind, String icao, Object value) {
        if (value == null) {
            return;
        }
        String key = formatKey(kind, icao);
        entries.put(key, new CachedValue(value, clock.instant()));
        log.debug("Cached feed entry: key={}", key);
    }

    @Override
    public void evict(String kind, String icao) {
        entries.remove(formatKey(kind, icao));
    }

    @Override
    public void clear() {
        entries.clear();
        log.debug("Feed cache cleared");
    }

    private boolean isStale(CachedValue cached) {
        return !clock.instant().isBefore(cached.storedAt().plus(ttl));
    }

    private record CachedValue(Object value, Instant storedAt) {
    }
}
