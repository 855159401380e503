package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.agent.ToolNotification.EventType;
import com.purchasingpower.toolagent.core.CompletionRecord;
import com.purchasingpower.toolagent.core.MetricsSnapshot;
import com.purchasingpower.toolagent.core.RequestPriority;
import com.purchasingpower.toolagent.core.ToolRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Base class for agents that wrap a single tool.
 *
 * <p>Handles the standard signals and leaves tool-specific behavior to subclasses:
 * <ul>
 *   <li>{@code tool_request} - submit {@code data.params} with optional
 *       {@code data.priority} and {@code data.request_id}</li>
 *   <li>{@code cancel_request} - cancel {@code data.request_id}</li>
 *   <li>{@code get_metrics} - publish a METRICS_REPORT notification with the
 *       counters and recent completions</li>
 *   <li>{@code clear_cache} - drop cached results, publish CACHE_CLEARED</li>
 *   <li>anything else - {@link #handleToolSignal(AgentSignal)}</li>
 * </ul>
 *
 * <p>Subclasses may override {@link #validateParams(Map)} and
 * {@link #processResult(Object, ToolRequest)}.
 *
 * @since 1.0.0
 */
@Slf4j
public abstract class BaseToolAgent implements ToolRequestHooks {

    private final String name;
    private final String toolName;
    private final ToolRequestLifecycleManager lifecycle;

    /**
     * @param builtInCacheTtlMs this agent's default cache TTL, or null for the global default
     */
    protected BaseToolAgent(String name, String toolName, Long builtInCacheTtlMs, ToolAgentRuntime runtime) {
        this.name = name;
        this.toolName = toolName;
        this.lifecycle = runtime.createLifecycleManager(name, toolName, builtInCacheTtlMs, this);
    }

    public String getName() {
        return name;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * Route an incoming signal.
     *
     * @return false if neither the standard handlers nor {@link #handleToolSignal} handled it
     */
    public boolean handleSignal(AgentSignal signal) {
        if (signal == null || signal.type() == null) {
            log.warn("[{}] Ignoring signal without a type", name);
            return false;
        }

        switch (signal.type()) {
            case AgentSignal.TOOL_REQUEST -> {
                submit(asParams(signal.get("params")),
                    RequestPriority.fromValue(signal.get("priority")),
                    signal.getString("request_id"));
                return true;
            }
            case AgentSignal.CANCEL_REQUEST -> {
                cancel(signal.getString("request_id"));
                return true;
            }
            case AgentSignal.GET_METRICS -> {
                publishMetrics();
                return true;
            }
            case AgentSignal.CLEAR_CACHE -> {
                clearCache();
                return true;
            }
            default -> {
                return handleToolSignal(signal);
            }
        }
    }

    public String submit(Map<String, Object> params, RequestPriority priority, String requestId) {
        return lifecycle.submit(params, priority, requestId);
    }

    public String submit(Map<String, Object> params) {
        return lifecycle.submit(params);
    }

    public CancelOutcome cancel(String requestId) {
        return lifecycle.cancel(requestId);
    }

    public MetricsSnapshot getMetrics() {
        return lifecycle.getMetrics();
    }

    public List<CompletionRecord> getHistory() {
        return lifecycle.getHistory();
    }

    public void clearCache() {
        lifecycle.clearCache();
        lifecycle.publishAgentEvent(EventType.CACHE_CLEARED);
    }

    /**
     * Tool-specific signals. The default logs and rejects the signal.
     */
    protected boolean handleToolSignal(AgentSignal signal) {
        log.warn("[{}] Received unknown signal: {}", name, signal.type());
        return false;
    }

    /**
     * Publish progress for the executing request; ignored if it is not executing.
     */
    protected boolean reportProgress(String requestId, Object progress) {
        return lifecycle.reportProgress(requestId, progress);
    }

    private void publishMetrics() {
        lifecycle.publishAgentEvent(EventType.METRICS_REPORT);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asParams(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }
}
