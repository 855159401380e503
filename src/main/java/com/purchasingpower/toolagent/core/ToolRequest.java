package com.purchasingpower.toolagent.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * A single unit of work submitted to a tool agent.
 *
 * <p>Immutable: a request is created on submission, moved from the queue into
 * the execution slot at most once, and discarded after completion.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ToolRequest {

    @NonNull
    String id;

    /**
     * Caller-defined parameters, forwarded to the tool as-is.
     */
    @NonNull
    @Builder.Default
    Map<String, Object> params = Map.of();

    @NonNull
    @Builder.Default
    RequestPriority priority = RequestPriority.NORMAL;

    /**
     * Monotonic submission time in milliseconds.
     */
    long createdAt;

    /**
     * Fingerprint of {@link #params}, see {@link CacheKeyGenerator}.
     */
    @NonNull
    String cacheKey;
}
