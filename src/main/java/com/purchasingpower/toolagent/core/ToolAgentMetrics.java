package com.purchasingpower.toolagent.core;

import java.time.Instant;
import java.util.List;

/**
 * Mutable counters for one tool agent. Only the owning lifecycle manager writes them.
 *
 * @since 1.0.0
 */
public final class ToolAgentMetrics {

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long cacheHits;
    private double averageExecutionTimeMs;
    private Instant lastRequestAt;

    public void recordCacheHit() {
        cacheHits++;
        lastRequestAt = Instant.now();
    }

    public void recordSuccess(long executionTimeMs) {
        totalRequests++;
        successfulRequests++;
        // incremental mean weighted by the number of successful completions
        averageExecutionTimeMs += (executionTimeMs - averageExecutionTimeMs) / successfulRequests;
        lastRequestAt = Instant.now();
    }

    public void recordFailure() {
        totalRequests++;
        failedRequests++;
        lastRequestAt = Instant.now();
    }

    public MetricsSnapshot snapshot(int queueLength, int activeCount, int cacheSize, List<CompletionRecord> recentCompletions) {
        return MetricsSnapshot.builder()
            .totalRequests(totalRequests)
            .successfulRequests(successfulRequests)
            .failedRequests(failedRequests)
            .cacheHits(cacheHits)
            .averageExecutionTimeMs(averageExecutionTimeMs)
            .lastRequestAt(lastRequestAt)
            .queueLength(queueLength)
            .activeCount(activeCount)
            .cacheSize(cacheSize)
            .recentCompletions(recentCompletions)
            .build();
    }
}
