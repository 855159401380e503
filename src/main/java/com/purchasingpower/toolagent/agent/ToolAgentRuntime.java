package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.agent.impl.TimeLimitedToolInvoker;
import com.purchasingpower.toolagent.configuration.AsyncConfig;
import com.purchasingpower.toolagent.configuration.ToolAgentProperties;
import com.purchasingpower.toolagent.core.CacheKeyGenerator;
import com.purchasingpower.toolagent.core.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Everything a tool agent needs to build its lifecycle manager, bundled so
 * agents take a single constructor argument.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolAgentRuntime {

    private final ToolAgentProperties properties;
    private final ToolRegistry toolRegistry;
    private final Executor dispatchExecutor;
    private final Executor toolExecutor;
    private final ToolNotificationSink notificationSink;
    private final Clock clock;
    private final CacheKeyGenerator cacheKeyGenerator;

    public ToolAgentRuntime(ToolAgentProperties properties,
                            ToolRegistry toolRegistry,
                            @Qualifier(AsyncConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor,
                            @Qualifier(AsyncConfig.TOOL_EXECUTOR) Executor toolExecutor,
                            ToolNotificationSink notificationSink,
                            Clock clock,
                            CacheKeyGenerator cacheKeyGenerator) {
        this.properties = properties;
        this.toolRegistry = toolRegistry;
        this.dispatchExecutor = dispatchExecutor;
        this.toolExecutor = toolExecutor;
        this.notificationSink = notificationSink;
        this.clock = clock;
        this.cacheKeyGenerator = cacheKeyGenerator;
    }

    /**
     * Build an independent lifecycle manager for one agent.
     */
    public ToolRequestLifecycleManager createLifecycleManager(String agentName,
                                                              String toolName,
                                                              Long builtInCacheTtlMs,
                                                              ToolRequestHooks hooks) {
        ToolAgentSettings settings = properties.resolve(agentName, builtInCacheTtlMs);
        log.info("Creating tool agent {} for tool {} with {}", agentName, toolName, settings);

        return ToolRequestLifecycleManager.builder()
            .agentName(agentName)
            .toolName(toolName)
            .settings(settings)
            .invoker(new TimeLimitedToolInvoker(toolRegistry, toolExecutor, settings.getToolTimeoutMs()))
            .hooks(hooks)
            .executor(dispatchExecutor)
            .notificationSink(notificationSink)
            .clock(clock)
            .cacheKeyGenerator(cacheKeyGenerator)
            .build();
    }
}
