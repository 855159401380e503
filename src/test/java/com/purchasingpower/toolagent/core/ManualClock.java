package com.purchasingpower.toolagent.core;

/**
 * Deterministic clock for tests.
 */
public final class ManualClock implements Clock {

    private long now;

    public ManualClock(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public synchronized long nowMillis() {
        return now;
    }

    public synchronized void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public synchronized void setMillis(long value) {
        now = value;
    }
}
