package com.purchasingpower.toolagent.agent;

import java.util.Map;

/**
 * Base interface for tools wrapped by tool agents.
 *
 * <p>A tool does the actual domain work (extraction, search, analysis...). It is
 * looked up by name through the {@link ToolRegistry} and never called directly
 * by the lifecycle manager, which only sees the {@link ToolInvoker} boundary.
 *
 * <p>Example implementation:
 * <pre>
 * public class WordCountTool implements Tool {
 *     public String getName() { return "word_count"; }
 *
 *     public String getDescription() { return "Count words in text"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; params) {
 *         String text = (String) params.get("text");
 *         return ToolResult.success(text.split("\\s+").length, "Counted words");
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Unique name for this tool (e.g., "regex_extractor", "todo_extractor").
     */
    String getName();

    /**
     * Human-readable description of what the tool does. Listed to callers that
     * ask for a tool that does not exist.
     */
    String getDescription();

    /**
     * Execute this tool with already validated parameters.
     *
     * <p>Expected failures should be returned as {@link ToolResult#failure(String)};
     * thrown exceptions are converted to failures by the caller.
     */
    ToolResult execute(Map<String, Object> parameters);
}
