package com.purchasingpower.toolagent.core;

import java.time.Instant;

/**
 * One finished request in an agent's history.
 *
 * @param executionTimeMs 0 for requests rejected before dispatch
 * @param completedAt     wall-clock completion time, for display
 */
public record CompletionRecord(String requestId, Outcome outcome, long executionTimeMs, Instant completedAt) {

    public enum Outcome {
        SUCCESS,
        FAILURE,
        CANCELLED
    }
}
