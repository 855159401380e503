package com.purchasingpower.toolagent.config;

import com.purchasingpower.toolagent.core.CacheKeyGenerator;
import com.purchasingpower.toolagent.core.Clock;
import com.purchasingpower.toolagent.core.SystemClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared collaborators for every tool agent.
 *
 * @since 1.0.0
 */
@Configuration
public class ToolAgentConfig {

    @Bean
    public Clock toolAgentClock() {
        return SystemClock.instance();
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }
}
