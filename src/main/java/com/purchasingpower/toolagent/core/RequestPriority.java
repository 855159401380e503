package com.purchasingpower.toolagent.core;

import java.util.Locale;

/**
 * Queue priority of a tool request. Lower rank dispatches first.
 *
 * @since 1.0.0
 */
public enum RequestPriority {
    HIGH(0),
    NORMAL(1),
    LOW(2);

    private final int rank;

    RequestPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Parse a priority from a signal payload value ("high", "normal", "low",
     * any case, or a {@code RequestPriority}). Missing or unrecognised values
     * fall back to {@link #NORMAL}.
     */
    public static RequestPriority fromValue(Object value) {
        if (value instanceof RequestPriority priority) {
            return priority;
        }
        if (value == null) {
            return NORMAL;
        }
        return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> NORMAL;
        };
    }
}
