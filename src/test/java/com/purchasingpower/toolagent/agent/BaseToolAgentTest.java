package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.agent.ToolNotification.EventType;
import com.purchasingpower.toolagent.configuration.ToolAgentProperties;
import com.purchasingpower.toolagent.core.CacheKeyGenerator;
import com.purchasingpower.toolagent.core.CompletionRecord;
import com.purchasingpower.toolagent.core.CompletionRecord.Outcome;
import com.purchasingpower.toolagent.core.ManualClock;
import com.purchasingpower.toolagent.core.MetricsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Base Tool Agent Tests")
class BaseToolAgentTest {

    private RecordingNotificationSink sink;
    private ManualClock clock;
    private EchoTool tool;
    private EchoAgent agent;

    @BeforeEach
    void setUp() {
        sink = new RecordingNotificationSink();
        clock = new ManualClock(1_000L);
        tool = new EchoTool();
        ToolAgentRuntime runtime = new ToolAgentRuntime(
            new ToolAgentProperties(),
            new ToolRegistry(List.of(tool)),
            Runnable::run,
            Runnable::run,
            sink,
            clock,
            new CacheKeyGenerator());
        agent = new EchoAgent(runtime);
    }

    @Test
    @DisplayName("tool_request signal submits with the given id and priority")
    void testToolRequestSignal() {
        // Given
        AgentSignal signal = new AgentSignal(AgentSignal.TOOL_REQUEST, Map.of(
            "params", Map.of("text", "hello"),
            "priority", "high",
            "request_id", "req-42"));

        // When
        boolean handled = agent.handleSignal(signal);

        // Then
        assertTrue(handled);
        List<ToolNotification> terminal = sink.terminalFor("req-42");
        assertEquals(1, terminal.size());
        assertEquals(EventType.RESULT, terminal.get(0).getType());
        assertEquals("echo_agent", terminal.get(0).getAgentName());
        assertEquals("echo", terminal.get(0).getToolName());
        assertEquals(Map.of("echo", "hello"), terminal.get(0).getResult());
    }

    @Test
    @DisplayName("Missing params are submitted as an empty map")
    void testToolRequestWithoutParams() {
        Map<String, Object> data = new HashMap<>();
        data.put("params", "not-a-map");
        data.put("request_id", "req-1");

        agent.handleSignal(new AgentSignal(AgentSignal.TOOL_REQUEST, data));

        assertEquals(Map.of(), tool.lastParams);
    }

    @Test
    @DisplayName("get_metrics publishes a metrics report")
    void testGetMetricsSignal() {
        agent.submit(Map.of("text", "a"));

        assertTrue(agent.handleSignal(AgentSignal.of(AgentSignal.GET_METRICS)));

        List<ToolNotification> reports = sink.ofType(EventType.METRICS_REPORT);
        assertEquals(1, reports.size());
        MetricsSnapshot metrics = reports.get(0).getMetrics();
        assertNotNull(metrics);
        assertEquals(1, metrics.getTotalRequests());
        assertEquals(1, metrics.getSuccessfulRequests());
        assertEquals(1, metrics.getCacheSize());
        assertNotNull(metrics.getLastRequestAt());
        assertEquals(1, metrics.getRecentCompletions().size());
    }

    @Test
    @DisplayName("History lists completions newest first")
    void testHistory() {
        String first = agent.submit(Map.of("text", "a"));
        String rejected = agent.submit(Map.of("text", ""));
        agent.submit(Map.of("text", "a"));

        List<CompletionRecord> history = agent.getHistory();

        assertEquals(2, history.size(), "Cache hits are not completions");
        assertEquals(rejected, history.get(0).requestId());
        assertEquals(Outcome.FAILURE, history.get(0).outcome());
        assertEquals(first, history.get(1).requestId());
        assertEquals(Outcome.SUCCESS, history.get(1).outcome());
        assertNotNull(history.get(1).completedAt());
    }

    @Test
    @DisplayName("A failing sink does not escape clear_cache or get_metrics")
    void testSinkFailureOnAgentSignals() {
        ToolAgentRuntime runtime = new ToolAgentRuntime(
            new ToolAgentProperties(),
            new ToolRegistry(List.of(tool)),
            Runnable::run,
            Runnable::run,
            notification -> {
                throw new IllegalStateException("listener down");
            },
            clock,
            new CacheKeyGenerator());
        EchoAgent failingSinkAgent = new EchoAgent(runtime);
        failingSinkAgent.submit(Map.of("text", "a"));

        assertDoesNotThrow(() -> failingSinkAgent.handleSignal(AgentSignal.of(AgentSignal.CLEAR_CACHE)));
        assertDoesNotThrow(() -> failingSinkAgent.handleSignal(AgentSignal.of(AgentSignal.GET_METRICS)));
        assertEquals(0, failingSinkAgent.getMetrics().getCacheSize());
    }

    @Test
    @DisplayName("clear_cache empties the cache and publishes CACHE_CLEARED")
    void testClearCacheSignal() {
        agent.submit(Map.of("text", "a"));
        agent.submit(Map.of("text", "a"));
        assertEquals(1, tool.calls.get());

        assertTrue(agent.handleSignal(AgentSignal.of(AgentSignal.CLEAR_CACHE)));
        agent.submit(Map.of("text", "a"));

        assertEquals(1, sink.ofType(EventType.CACHE_CLEARED).size());
        assertEquals(2, tool.calls.get());
        assertEquals(1, agent.getMetrics().getCacheHits());
    }

    @Test
    @DisplayName("cancel_request for an unknown id is handled silently")
    void testCancelUnknownSignal() {
        boolean handled = agent.handleSignal(new AgentSignal(AgentSignal.CANCEL_REQUEST, Map.of("request_id", "ghost")));

        assertTrue(handled);
        assertTrue(sink.all().isEmpty());
        assertEquals(CancelOutcome.NOT_FOUND, agent.cancel("ghost"));
    }

    @Test
    @DisplayName("Unknown signals go to the tool-specific handler")
    void testUnknownSignal() {
        assertFalse(agent.handleSignal(AgentSignal.of("mystery")));
        assertTrue(agent.handleSignal(AgentSignal.of("shout")));
        assertFalse(agent.handleSignal(null));
        assertFalse(agent.handleSignal(new AgentSignal(null, null)));
    }

    @Test
    @DisplayName("Validation hook rejects before the tool runs")
    void testValidationHook() {
        String id = agent.submit(Map.of("text", ""));

        ToolNotification error = sink.terminalFor(id).get(0);
        assertEquals(EventType.ERROR, error.getType());
        assertEquals("Validation failed: text is required", error.getError());
        assertEquals(0, tool.calls.get());
    }

    @Test
    @DisplayName("Unregistered tool fails with the list of valid tools")
    void testUnknownTool() {
        ToolAgentRuntime runtime = new ToolAgentRuntime(
            new ToolAgentProperties(),
            new ToolRegistry(List.of(tool)),
            Runnable::run,
            Runnable::run,
            sink,
            clock,
            new CacheKeyGenerator());
        BaseToolAgent orphan = new BaseToolAgent("orphan_agent", "missing", null, runtime) { };

        String id = orphan.submit(Map.of());

        ToolNotification error = sink.terminalFor(id).get(0);
        assertEquals(EventType.ERROR, error.getType());
        assertTrue(error.getError().contains("does not exist"));
        assertTrue(error.getError().contains("echo"));
    }

    static class EchoTool implements Tool {

        final AtomicInteger calls = new AtomicInteger();
        volatile Map<String, Object> lastParams;

        @Override
        public String getName() {
            return "echo";
        }

        @Override
        public String getDescription() {
            return "Echoes text";
        }

        @Override
        public ToolResult execute(Map<String, Object> parameters) {
            calls.incrementAndGet();
            lastParams = parameters;
            return ToolResult.success(Map.of("echo", String.valueOf(parameters.get("text"))), "echoed");
        }
    }

    static class EchoAgent extends BaseToolAgent {

        EchoAgent(ToolAgentRuntime runtime) {
            super("echo_agent", "echo", null, runtime);
        }

        @Override
        public ParamValidation validateParams(Map<String, Object> params) {
            if (params.containsKey("text") && "".equals(params.get("text"))) {
                return ParamValidation.invalid("text is required");
            }
            return ParamValidation.valid(params);
        }

        @Override
        protected boolean handleToolSignal(AgentSignal signal) {
            if ("shout".equals(signal.type())) {
                return true;
            }
            return super.handleToolSignal(signal);
        }
    }
}
