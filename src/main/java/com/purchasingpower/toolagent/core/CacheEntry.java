package com.purchasingpower.toolagent.core;

/**
 * A cached successful tool result.
 *
 * @param result   processed tool payload
 * @param cachedAt monotonic time the entry was written, in milliseconds
 */
public record CacheEntry(Object result, long cachedAt) {

    public boolean isFresh(long now, long ttlMillis) {
        return now - cachedAt < ttlMillis;
    }
}
