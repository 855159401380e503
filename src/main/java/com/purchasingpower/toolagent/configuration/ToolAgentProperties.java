package com.purchasingpower.toolagent.configuration;

import com.purchasingpower.toolagent.agent.ToolAgentSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Limits for tool agents, loaded from the {@code app.tool-agents} namespace.
 *
 * <pre>
 * app:
 *   tool-agents:
 *     defaults:
 *       cache-ttl-ms: 300000
 *       rate-limit-window-ms: 60000
 *       rate-limit-max: 100
 *       tool-timeout-ms: 30000
 *     agents:
 *       "[regex_extractor_agent]":
 *         rate-limit-max: 50
 * </pre>
 *
 * <p>Agent names contain underscores, so map keys need the bracket notation.
 * A per-agent value wins over the agent's built-in cache TTL, which wins over
 * {@code defaults}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.tool-agents")
public class ToolAgentProperties {

    @Valid
    @NotNull
    private Limits defaults = new Limits();

    @Valid
    @NotNull
    private Map<String, LimitOverrides> agents = new HashMap<>();

    /**
     * Settings for one agent.
     *
     * @param agentName        agent name as registered
     * @param builtInCacheTtlMs the agent's own TTL default, or null to use {@code defaults}
     */
    public ToolAgentSettings resolve(String agentName, Long builtInCacheTtlMs) {
        LimitOverrides overrides = agents.getOrDefault(agentName, new LimitOverrides());

        long cacheTtl = firstNonNull(overrides.getCacheTtlMs(), builtInCacheTtlMs, defaults.getCacheTtlMs());
        long window = firstNonNull(overrides.getRateLimitWindowMs(), null, defaults.getRateLimitWindowMs());
        long timeout = firstNonNull(overrides.getToolTimeoutMs(), null, defaults.getToolTimeoutMs());
        int max = overrides.getRateLimitMax() != null ? overrides.getRateLimitMax() : defaults.getRateLimitMax();
        int historySize = overrides.getMaxHistorySize() != null
            ? overrides.getMaxHistorySize()
            : defaults.getMaxHistorySize();

        return ToolAgentSettings.builder()
            .cacheTtlMs(cacheTtl)
            .rateLimitWindowMs(window)
            .rateLimitMax(max)
            .toolTimeoutMs(timeout)
            .maxHistorySize(historySize)
            .build();
    }

    private static long firstNonNull(Long override, Long builtIn, long fallback) {
        if (override != null) {
            return override;
        }
        return builtIn != null ? builtIn : fallback;
    }

    @Data
    public static class Limits {

        /**
         * Maximum age of a cached result.
         * Default: 300000 (5 minutes)
         */
        @Positive
        private long cacheTtlMs = 300_000L;

        /**
         * Length of the sliding rate-limit window.
         * Default: 60000 (1 minute)
         */
        @Positive
        private long rateLimitWindowMs = 60_000L;

        /**
         * Admissions allowed per window.
         * Default: 100
         */
        @Positive
        private int rateLimitMax = 100;

        /**
         * Upper bound for a single tool invocation.
         * Default: 30000 (30 seconds)
         */
        @Positive
        private long toolTimeoutMs = 30_000L;

        /**
         * Completions kept in each agent's history.
         * Default: 100
         */
        @Positive
        private int maxHistorySize = 100;
    }

    /**
     * Per-agent overrides; null fields fall back.
     */
    @Data
    public static class LimitOverrides {

        @Positive
        private Long cacheTtlMs;

        @Positive
        private Long rateLimitWindowMs;

        @Positive
        private Integer rateLimitMax;

        @Positive
        private Long toolTimeoutMs;

        @Positive
        private Integer maxHistorySize;
    }
}
