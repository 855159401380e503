package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.core.CompletionHistory;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved limits for one tool agent.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ToolAgentSettings {

    /**
     * Maximum age of a cached result before it reads as a miss.
     */
    @Builder.Default
    long cacheTtlMs = 300_000L;

    @Builder.Default
    long rateLimitWindowMs = 60_000L;

    /**
     * Admissions allowed per window.
     */
    @Builder.Default
    int rateLimitMax = 100;

    /**
     * Upper bound for a single tool invocation, enforced by the invoker.
     */
    @Builder.Default
    long toolTimeoutMs = 30_000L;

    /**
     * Completions kept in the agent's history.
     */
    @Builder.Default
    int maxHistorySize = CompletionHistory.DEFAULT_MAX_SIZE;
}
