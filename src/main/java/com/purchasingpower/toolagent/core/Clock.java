package com.purchasingpower.toolagent.core;

/**
 * Monotonic time source for rate-limit windows, cache TTLs and execution timing.
 *
 * <p>Values are milliseconds from an arbitrary origin. Only differences between
 * two readings are meaningful; never compare them with wall-clock time.
 *
 * @since 1.0.0
 */
public interface Clock {

    long nowMillis();
}
