package com.purchasingpower.toolagent.core;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;

/**
 * Sliding-window log limiter: keeps the timestamp of every admission inside
 * the trailing window and admits while fewer than {@code maxRequests} remain.
 *
 * <p>Capacity refills as old admissions age out of the window, never all at once.
 * Denied calls are not recorded.
 *
 * <p>Not thread-safe. Each instance belongs to one {@code ToolRequestLifecycleManager},
 * which serializes access.
 *
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter {

    private final Clock clock;
    private final long windowMillis;
    private final int maxRequests;

    private final ArrayDeque<Long> admissions = new ArrayDeque<>();

    public SlidingWindowRateLimiter(Clock clock, long windowMillis, int maxRequests) {
        Preconditions.checkNotNull(clock, "Clock cannot be null");
        Preconditions.checkArgument(windowMillis > 0, "Rate limit window must be positive");
        Preconditions.checkArgument(maxRequests > 0, "Rate limit max must be positive");
        this.clock = clock;
        this.windowMillis = windowMillis;
        this.maxRequests = maxRequests;
    }

    public RateLimitDecision admit() {
        long now = clock.nowMillis();
        prune(now);

        if (admissions.size() < maxRequests) {
            admissions.addLast(now);
            return RateLimitDecision.allow();
        }

        long oldest = admissions.peekFirst();
        long retryAfterMillis = (oldest + windowMillis) - now;
        return RateLimitDecision.deny(retryAfterMillis / 1000L);
    }

    /**
     * Admissions still inside the window as of now.
     */
    public int currentCount() {
        prune(clock.nowMillis());
        return admissions.size();
    }

    private void prune(long now) {
        long cutoff = now - windowMillis;
        while (!admissions.isEmpty() && admissions.peekFirst() <= cutoff) {
            admissions.removeFirst();
        }
    }
}
