package com.purchasingpower.toolagent.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for tool agents.
 *
 * Lifecycle managers dispatch requests on the dispatch pool. Each dispatched
 * request hands the tool itself to the execution pool so the invoker can
 * enforce a timeout without blocking a dispatch thread forever.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String DISPATCH_EXECUTOR = "toolDispatchExecutor";
    public static final String TOOL_EXECUTOR = "toolExecutionExecutor";

    @Bean(name = DISPATCH_EXECUTOR)
    public Executor toolDispatchExecutor() {
        // each agent runs at most one request at a time
        return buildExecutor("tool-dispatch-", 4, 16, 200);
    }

    @Bean(name = TOOL_EXECUTOR)
    public Executor toolExecutionExecutor() {
        return buildExecutor("tool-exec-", 4, 16, 200);
    }

    private Executor buildExecutor(String threadNamePrefix, int corePoolSize, int maxPoolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // Wait for running tools on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Executor {} configured: core={}, max={}, queue={}",
                threadNamePrefix,
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
