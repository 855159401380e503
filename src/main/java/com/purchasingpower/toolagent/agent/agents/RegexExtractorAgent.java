package com.purchasingpower.toolagent.agent.agents;

import com.purchasingpower.toolagent.agent.AgentSignal;
import com.purchasingpower.toolagent.agent.BaseToolAgent;
import com.purchasingpower.toolagent.agent.ParamValidation;
import com.purchasingpower.toolagent.agent.ToolAgentRuntime;
import com.purchasingpower.toolagent.agent.tools.RegexExtractorTool;
import com.purchasingpower.toolagent.core.RequestPriority;
import com.purchasingpower.toolagent.core.ToolRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Agent for the {@code regex_extractor} tool.
 *
 * <p>Besides the standard signals it accepts {@code extract_pattern}, whose data
 * ({@code content}, {@code pattern}, {@code extraction_mode}, {@code max_matches})
 * becomes a tool request.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class RegexExtractorAgent extends BaseToolAgent {

    public static final String NAME = "regex_extractor_agent";
    public static final String EXTRACT_PATTERN = "extract_pattern";

    private static final long CACHE_TTL_MS = 600_000L;
    private static final Set<String> MODES = Set.of("matches", "groups");

    public RegexExtractorAgent(ToolAgentRuntime runtime) {
        super(NAME, RegexExtractorTool.NAME, CACHE_TTL_MS, runtime);
    }

    @Override
    public ParamValidation validateParams(Map<String, Object> params) {
        if (!(params.get("content") instanceof String)) {
            return ParamValidation.invalid("content must be a string");
        }
        if (!(params.get("pattern") instanceof String pattern) || pattern.isBlank()) {
            return ParamValidation.invalid("pattern is required");
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            return ParamValidation.invalid("invalid pattern: " + e.getDescription());
        }

        Map<String, Object> normalized = new LinkedHashMap<>(params);
        Object mode = normalized.getOrDefault("extraction_mode", "matches");
        if (!MODES.contains(String.valueOf(mode))) {
            return ParamValidation.invalid("extraction_mode must be one of " + MODES);
        }
        normalized.put("extraction_mode", String.valueOf(mode));
        return ParamValidation.valid(normalized);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object processResult(Object data, ToolRequest request) {
        if (!(data instanceof Map<?, ?> map)) {
            return data;
        }
        Map<String, Object> processed = new LinkedHashMap<>((Map<String, Object>) map);
        processed.put("pattern", request.getParams().get("pattern"));
        processed.put("match_count", processed.getOrDefault("total_matches", 0));
        return processed;
    }

    @Override
    protected boolean handleToolSignal(AgentSignal signal) {
        if (!EXTRACT_PATTERN.equals(signal.type())) {
            return super.handleToolSignal(signal);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("content", signal.get("content"));
        params.put("pattern", signal.get("pattern"));
        params.put("extraction_mode", signal.data().getOrDefault("extraction_mode", "matches"));
        params.put("max_matches", signal.data().getOrDefault("max_matches", 0));

        String requestId = submit(params, RequestPriority.fromValue(signal.get("priority")),
            signal.getString("request_id"));
        log.debug("[{}] extract_pattern submitted as {}", NAME, requestId);
        return true;
    }
}
