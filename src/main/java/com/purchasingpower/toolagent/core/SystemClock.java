package com.purchasingpower.toolagent.core;

/**
 * Clock backed by {@link System#nanoTime()}, unaffected by wall-clock adjustments.
 *
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMillis() {
        return System.nanoTime() / 1_000_000L;
    }
}
