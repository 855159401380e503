package com.purchasingpower.toolagent.agent.agents;

import com.purchasingpower.toolagent.agent.AgentSignal;
import com.purchasingpower.toolagent.agent.BaseToolAgent;
import com.purchasingpower.toolagent.agent.ParamValidation;
import com.purchasingpower.toolagent.agent.ToolAgentRuntime;
import com.purchasingpower.toolagent.agent.tools.TodoExtractorTool;
import com.purchasingpower.toolagent.core.RequestPriority;
import com.purchasingpower.toolagent.core.ToolRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Agent for the {@code todo_extractor} tool.
 *
 * <p>Besides the standard signals it accepts {@code extract_todos}, whose data
 * ({@code code}, {@code patterns}, {@code priority_keywords}) becomes a tool request.
 *
 * @since 1.0.0
 */
@Component
public class TodoExtractorAgent extends BaseToolAgent {

    public static final String NAME = "todo_extractor_agent";
    public static final String EXTRACT_TODOS = "extract_todos";

    private static final List<String> PARAM_KEYS = List.of("code", "patterns", "priority_keywords");

    public TodoExtractorAgent(ToolAgentRuntime runtime) {
        super(NAME, TodoExtractorTool.NAME, null, runtime);
    }

    @Override
    public ParamValidation validateParams(Map<String, Object> params) {
        if (!(params.get("code") instanceof String code) || code.isBlank()) {
            return ParamValidation.invalid("code is required");
        }

        Object patterns = params.get("patterns");
        if (patterns == null) {
            return ParamValidation.valid(params);
        }
        if (!(patterns instanceof List<?> list) || list.stream().anyMatch(p -> !(p instanceof String))) {
            return ParamValidation.invalid("patterns must be a list of strings");
        }

        Map<String, Object> normalized = new LinkedHashMap<>(params);
        normalized.put("patterns", list.stream()
            .map(p -> ((String) p).trim().toUpperCase(Locale.ROOT))
            .filter(p -> !p.isEmpty())
            .toList());
        return ParamValidation.valid(normalized);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object processResult(Object data, ToolRequest request) {
        if (!(data instanceof Map<?, ?> map) || !(map.get("todos") instanceof List<?> todos)) {
            return data;
        }
        long highPriority = todos.stream()
            .filter(t -> t instanceof Map<?, ?> item && "high".equals(item.get("priority")))
            .count();
        Map<String, Object> processed = new LinkedHashMap<>((Map<String, Object>) map);
        processed.put("high_priority_count", highPriority);
        return processed;
    }

    @Override
    protected boolean handleToolSignal(AgentSignal signal) {
        if (!EXTRACT_TODOS.equals(signal.type())) {
            return super.handleToolSignal(signal);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        for (String key : PARAM_KEYS) {
            if (signal.data().containsKey(key)) {
                params.put(key, signal.get(key));
            }
        }
        submit(params, RequestPriority.fromValue(signal.get("priority")), signal.getString("request_id"));
        return true;
    }
}
