package com.purchasingpower.toolagent.agent;

import java.util.Map;

/**
 * Incoming message routed to a tool agent.
 *
 * @param type signal type, e.g. {@code tool_request} or {@code clear_cache}
 * @param data signal payload
 */
public record AgentSignal(String type, Map<String, Object> data) {

    public static final String TOOL_REQUEST = "tool_request";
    public static final String CANCEL_REQUEST = "cancel_request";
    public static final String GET_METRICS = "get_metrics";
    public static final String CLEAR_CACHE = "clear_cache";

    public AgentSignal {
        data = data != null ? data : Map.of();
    }

    public static AgentSignal of(String type) {
        return new AgentSignal(type, Map.of());
    }

    public Object get(String key) {
        return data.get(key);
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
