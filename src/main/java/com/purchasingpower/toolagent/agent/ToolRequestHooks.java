package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.core.ToolRequest;

import java.util.Map;

/**
 * Agent-specific callbacks around a tool invocation. Both run on the
 * dispatch thread, outside the lifecycle manager's lock.
 *
 * @since 1.0.0
 */
public interface ToolRequestHooks {

    ToolRequestHooks NONE = new ToolRequestHooks() { };

    /**
     * Check and optionally normalize parameters before invocation.
     * An invalid result ends the request with a validation error.
     */
    default ParamValidation validateParams(Map<String, Object> params) {
        return ParamValidation.valid(params);
    }

    /**
     * Transform a successful tool payload before it is cached and published.
     */
    default Object processResult(Object data, ToolRequest request) {
        return data;
    }
}
