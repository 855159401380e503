package com.purchasingpower.toolagent.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a tool agent's counters and queue state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    /**
     * Completed executions (successful + failed). Cache hits are counted separately.
     */
    private long totalRequests;

    private long successfulRequests;

    private long failedRequests;

    private long cacheHits;

    /**
     * Running average over successful executions, in milliseconds.
     */
    private double averageExecutionTimeMs;

    /**
     * Wall-clock time of the last completion or cache hit; null before the first one.
     */
    private Instant lastRequestAt;

    private int queueLength;

    private int activeCount;

    private int cacheSize;

    /**
     * Most recent completions, newest first.
     */
    private List<CompletionRecord> recentCompletions;
}
