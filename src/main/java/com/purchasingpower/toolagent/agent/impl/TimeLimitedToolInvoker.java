package com.purchasingpower.toolagent.agent.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.toolagent.agent.Tool;
import com.purchasingpower.toolagent.agent.ToolInvoker;
import com.purchasingpower.toolagent.agent.ToolRegistry;
import com.purchasingpower.toolagent.agent.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes registered tools on the tool execution pool and gives up after a timeout.
 *
 * <p>A timed-out tool is cancelled but, like any Java task, only stops if it
 * reacts to interruption. Unknown tools, timeouts and thrown exceptions are all
 * returned as {@link ToolResult#failure(String)}.
 *
 * @since 1.0.0
 */
@Slf4j
public class TimeLimitedToolInvoker implements ToolInvoker {

    private final ToolRegistry toolRegistry;
    private final Executor toolExecutor;
    private final long timeoutMs;

    public TimeLimitedToolInvoker(ToolRegistry toolRegistry, Executor toolExecutor, long timeoutMs) {
        Preconditions.checkNotNull(toolRegistry, "Tool registry cannot be null");
        Preconditions.checkNotNull(toolExecutor, "Tool executor cannot be null");
        Preconditions.checkArgument(timeoutMs > 0, "Tool timeout must be positive");
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public ToolResult invoke(String toolName, Map<String, Object> params) {
        Optional<Tool> tool = toolRegistry.find(toolName);
        if (tool.isEmpty()) {
            log.warn("Unknown tool '{}'. Valid tools: {}", toolName, toolRegistry.getToolNames());
            return ToolResult.failure("Tool '" + toolName + "' does not exist. Valid tools: "
                + String.join(", ", toolRegistry.describeTools()));
        }

        CompletableFuture<ToolResult> future =
            CompletableFuture.supplyAsync(() -> tool.get().execute(params), toolExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool {} timed out after {}ms", toolName, timeoutMs);
            return ToolResult.failure("Tool '" + toolName + "' timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Tool {} failed", toolName, cause);
            return ToolResult.failure("Tool execution failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure("Tool execution interrupted");
        }
    }
}
