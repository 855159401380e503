package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.core.MetricsSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification published by a tool agent.
 *
 * Event types:
 * - STARTED: Request moved into the execution slot
 * - PROGRESS: Intermediate progress from a long-running tool
 * - RESULT: Successful result, live or from cache (terminal)
 * - ERROR: Validation or invocation failure (terminal)
 * - CANCELLED: Request cancelled while queued or executing (terminal)
 * - RATE_LIMITED: Admission denied, see retryAfterSeconds (terminal)
 * - METRICS_REPORT: Answer to a get_metrics signal
 * - CACHE_CLEARED: Answer to a clear_cache signal
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolNotification {

    private String agentName;
    private String toolName;
    private String requestId;
    private EventType type;
    private Object result;
    private boolean fromCache;
    private Long executionTimeMs;
    private String error;
    private Long retryAfterSeconds;
    private MetricsSnapshot metrics;

    public enum EventType {
        STARTED,
        PROGRESS,
        RESULT,
        ERROR,
        CANCELLED,
        RATE_LIMITED,
        METRICS_REPORT,
        CACHE_CLEARED;

        public boolean isTerminal() {
            return this == RESULT || this == ERROR || this == CANCELLED || this == RATE_LIMITED;
        }
    }

    public boolean isTerminal() {
        return type != null && type.isTerminal();
    }
}
