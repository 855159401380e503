package com.purchasingpower.toolagent.agent.tools;

import com.purchasingpower.toolagent.agent.Tool;
import com.purchasingpower.toolagent.agent.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds deferred-work comments (TODO, FIXME...) in source code.
 *
 * @since 1.0.0
 */
@Component
public class TodoExtractorTool implements Tool {

    public static final String NAME = "todo_extractor";

    public static final List<String> DEFAULT_MARKERS = List.of("TODO", "FIXME", "HACK", "BUG", "NOTE", "OPTIMIZE");
    public static final List<String> DEFAULT_PRIORITY_KEYWORDS = List.of("URGENT", "CRITICAL", "IMPORTANT", "ASAP");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Scan code for TODO, FIXME and other deferred work comments.";
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        if (!(parameters.get("code") instanceof String code)) {
            return ToolResult.failure("code parameter is required");
        }
        List<String> markers = stringList(parameters.get("patterns"), DEFAULT_MARKERS);
        List<String> priorityKeywords = stringList(parameters.get("priority_keywords"), DEFAULT_PRIORITY_KEYWORDS);

        Pattern markerPattern = Pattern.compile("\\b("
            + markers.stream().map(Pattern::quote).collect(Collectors.joining("|"))
            + ")\\b[:\\s]*(.*)$");

        List<Map<String, Object>> todos = new ArrayList<>();
        Map<String, Long> byType = new TreeMap<>();
        String[] lines = code.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = markerPattern.matcher(lines[i]);
            if (!matcher.find()) {
                continue;
            }
            String type = matcher.group(1);
            String text = matcher.group(2).trim();
            String upperText = text.toUpperCase(Locale.ROOT);
            boolean highPriority = priorityKeywords.stream().anyMatch(upperText::contains);

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("line", i + 1);
            item.put("type", type);
            item.put("text", text);
            item.put("priority", highPriority ? "high" : "normal");
            todos.add(item);
            byType.merge(type, 1L, Long::sum);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("todos", todos);
        data.put("total_count", todos.size());
        data.put("by_type", byType);
        return ToolResult.success(data, "Found " + todos.size() + " deferred work items");
    }

    private static List<String> stringList(Object raw, List<String> fallback) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            return fallback;
        }
        return list.stream().map(String::valueOf).collect(Collectors.toList());
    }
}
