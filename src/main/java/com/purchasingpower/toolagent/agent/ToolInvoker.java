package com.purchasingpower.toolagent.agent;

import java.util.Map;

/**
 * Boundary between the lifecycle manager and the code that does the work.
 *
 * <p>Implementations report failures through {@link ToolResult#failure(String)}.
 * Any timeout policy belongs here; the lifecycle manager never times out an
 * invocation, so an invoker that hangs keeps the agent's execution slot busy.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ToolInvoker {

    ToolResult invoke(String toolName, Map<String, Object> params);
}
