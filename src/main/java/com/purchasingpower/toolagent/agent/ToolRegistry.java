package com.purchasingpower.toolagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * All {@link Tool} beans, indexed by name.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> toolsByName = new LinkedHashMap<>();

    public ToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            Tool previous = toolsByName.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name '" + tool.getName() + "': "
                    + previous.getClass().getName() + " and " + tool.getClass().getName());
            }
        }
        log.info("Registered {} tools: {}", toolsByName.size(), toolsByName.keySet());
    }

    public Optional<Tool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(toolName));
    }

    public Set<String> getToolNames() {
        return toolsByName.keySet();
    }

    /**
     * One {@code name (description)} entry per tool, in registration order.
     */
    public List<String> describeTools() {
        return toolsByName.values().stream()
            .map(tool -> tool.getName() + " (" + tool.getDescription() + ")")
            .collect(Collectors.toList());
    }
}
