package com.purchasingpower.toolagent.integration;

import com.purchasingpower.toolagent.agent.AgentSignal;
import com.purchasingpower.toolagent.agent.BaseToolAgent;
import com.purchasingpower.toolagent.agent.ToolAgentRegistry;
import com.purchasingpower.toolagent.agent.ToolNotification;
import com.purchasingpower.toolagent.agent.ToolNotification.EventType;
import com.purchasingpower.toolagent.agent.agents.RegexExtractorAgent;
import com.purchasingpower.toolagent.agent.agents.TodoExtractorAgent;
import com.purchasingpower.toolagent.configuration.ToolAgentProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application and runs requests through the real thread pools:
 * signal -> registry -> agent -> lifecycle manager -> tool -> Spring event.
 */
@SpringBootTest
@DisplayName("Tool Agent Application Tests")
class ToolAgentApplicationTest {

    @Autowired
    private ToolAgentRegistry registry;

    @Autowired
    private ToolAgentProperties properties;

    @Autowired
    private NotificationCollector collector;

    @Test
    @DisplayName("Both agents are registered and configured from application.yml")
    void testWiring() {
        assertThat(registry.getAgents())
            .extracting(BaseToolAgent::getName)
            .containsExactlyInAnyOrder(RegexExtractorAgent.NAME, TodoExtractorAgent.NAME);

        assertEquals(100, properties.getDefaults().getRateLimitMax());
        assertEquals(15_000L, properties.resolve(TodoExtractorAgent.NAME, null).getToolTimeoutMs());
    }

    @Test
    @DisplayName("tool_request signal produces a RESULT event")
    @SuppressWarnings("unchecked")
    void testToolRequestEndToEnd() throws InterruptedException {
        registry.dispatch(TodoExtractorAgent.NAME, new AgentSignal(AgentSignal.TOOL_REQUEST, Map.of(
            "params", Map.of("code", "// TODO wire it\n// FIXME asap"),
            "request_id", "it-todo-1")));

        ToolNotification result = awaitTerminal("it-todo-1");

        assertEquals(EventType.RESULT, result.getType());
        Map<String, Object> data = (Map<String, Object>) result.getResult();
        assertEquals(2, data.get("total_count"));
        assertEquals(1L, data.get("high_priority_count"));
        assertTrue(collector.forRequest("it-todo-1").stream().anyMatch(n -> n.getType() == EventType.STARTED));
    }

    @Test
    @DisplayName("Invalid request surfaces as an ERROR event")
    void testValidationErrorEndToEnd() throws InterruptedException {
        registry.dispatch(RegexExtractorAgent.NAME, new AgentSignal(AgentSignal.TOOL_REQUEST, Map.of(
            "params", Map.of("content", "abc", "pattern", "(open"),
            "request_id", "it-regex-bad")));

        ToolNotification error = awaitTerminal("it-regex-bad");

        assertEquals(EventType.ERROR, error.getType());
        assertTrue(error.getError().startsWith("Validation failed"));
    }

    private ToolNotification awaitTerminal(String requestId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            List<ToolNotification> terminal = collector.forRequest(requestId).stream()
                .filter(ToolNotification::isTerminal)
                .toList();
            if (!terminal.isEmpty()) {
                assertEquals(1, terminal.size());
                return terminal.get(0);
            }
            Thread.sleep(20);
        }
        return fail("No terminal notification for " + requestId);
    }

    @TestConfiguration
    static class CollectorConfig {

        @Bean
        NotificationCollector notificationCollector() {
            return new NotificationCollector();
        }
    }

    static class NotificationCollector {

        private final List<ToolNotification> received = new CopyOnWriteArrayList<>();

        @EventListener
        public void onNotification(ToolNotification notification) {
            received.add(notification);
        }

        List<ToolNotification> forRequest(String requestId) {
            return received.stream()
                .filter(n -> requestId.equals(n.getRequestId()))
                .toList();
        }
    }
}
