package com.purchasingpower.toolagent.configuration;

import com.purchasingpower.toolagent.agent.ToolAgentSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tool Agent Properties Tests")
class ToolAgentPropertiesTest {

    @Test
    @DisplayName("Defaults apply when nothing is overridden")
    void testDefaults() {
        ToolAgentSettings settings = new ToolAgentProperties().resolve("any_agent", null);

        assertEquals(300_000L, settings.getCacheTtlMs());
        assertEquals(60_000L, settings.getRateLimitWindowMs());
        assertEquals(100, settings.getRateLimitMax());
        assertEquals(30_000L, settings.getToolTimeoutMs());
        assertEquals(100, settings.getMaxHistorySize());
    }

    @Test
    @DisplayName("Built-in TTL beats defaults, configured override beats both")
    void testCacheTtlPrecedence() {
        ToolAgentProperties properties = new ToolAgentProperties();
        assertEquals(600_000L, properties.resolve("regex_extractor_agent", 600_000L).getCacheTtlMs());

        ToolAgentProperties.LimitOverrides overrides = new ToolAgentProperties.LimitOverrides();
        overrides.setCacheTtlMs(1_000L);
        properties.getAgents().put("regex_extractor_agent", overrides);

        assertEquals(1_000L, properties.resolve("regex_extractor_agent", 600_000L).getCacheTtlMs());
    }

    @Test
    @DisplayName("Overrides are per field and per agent")
    void testPartialOverride() {
        ToolAgentProperties properties = new ToolAgentProperties();
        properties.getDefaults().setRateLimitMax(10);
        ToolAgentProperties.LimitOverrides overrides = new ToolAgentProperties.LimitOverrides();
        overrides.setToolTimeoutMs(5_000L);
        overrides.setMaxHistorySize(20);
        properties.getAgents().put("todo_extractor_agent", overrides);

        ToolAgentSettings todo = properties.resolve("todo_extractor_agent", null);
        ToolAgentSettings other = properties.resolve("regex_extractor_agent", null);

        assertEquals(5_000L, todo.getToolTimeoutMs());
        assertEquals(10, todo.getRateLimitMax());
        assertEquals(30_000L, other.getToolTimeoutMs());
        assertEquals(10, other.getRateLimitMax());
        assertEquals(20, todo.getMaxHistorySize());
        assertEquals(100, other.getMaxHistorySize());
    }
}
