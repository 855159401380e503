package com.purchasingpower.toolagent.core;

/**
 * Outcome of an admission check.
 *
 * @param allowed           whether the request may proceed
 * @param retryAfterSeconds whole seconds until a slot frees up; 0 when allowed
 */
public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, 0L);
    }

    public static RateLimitDecision deny(long retryAfterSeconds) {
        return new RateLimitDecision(false, Math.max(0L, retryAfterSeconds));
    }
}
