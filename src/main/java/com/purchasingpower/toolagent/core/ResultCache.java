package com.purchasingpower.toolagent.core;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed result cache with lazy TTL expiry.
 *
 * <p>An entry older than the TTL reads as a miss but stays in the map until it
 * is overwritten or the cache is cleared. There is no background sweep.
 *
 * <p>Not thread-safe; owned by a single lifecycle manager.
 *
 * @since 1.0.0
 */
@Slf4j
public final class ResultCache {

    private final Clock clock;
    private final long ttlMillis;
    private final Map<String, CacheEntry> entries = new HashMap<>();

    public ResultCache(Clock clock, long ttlMillis) {
        Preconditions.checkNotNull(clock, "Clock cannot be null");
        Preconditions.checkArgument(ttlMillis > 0, "Cache TTL must be positive");
        this.clock = clock;
        this.ttlMillis = ttlMillis;
    }

    public Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFresh(clock.nowMillis(), ttlMillis)) {
            log.debug("Cache entry {} expired", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.result());
    }

    public void put(String key, Object result) {
        put(key, result, clock.nowMillis());
    }

    public void put(String key, Object result, long cachedAt) {
        Preconditions.checkNotNull(key, "Cache key cannot be null");
        entries.put(key, new CacheEntry(result, cachedAt));
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Physical entry count, including expired entries not yet overwritten.
     */
    public int size() {
        return entries.size();
    }
}
