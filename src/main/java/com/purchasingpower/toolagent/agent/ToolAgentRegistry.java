package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.exception.UnknownToolAgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up tool agents by name and routes signals to them.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolAgentRegistry {

    private final Map<String, BaseToolAgent> agentsByName = new LinkedHashMap<>();

    public ToolAgentRegistry(List<BaseToolAgent> agents) {
        for (BaseToolAgent agent : agents) {
            if (agentsByName.putIfAbsent(agent.getName(), agent) != null) {
                throw new IllegalStateException("Duplicate tool agent name: " + agent.getName());
            }
        }
        log.info("Registered {} tool agents: {}", agentsByName.size(), agentsByName.keySet());
    }

    public Optional<BaseToolAgent> find(String agentName) {
        return Optional.ofNullable(agentsByName.get(agentName));
    }

    public BaseToolAgent get(String agentName) {
        return find(agentName).orElseThrow(() -> new UnknownToolAgentException(agentName));
    }

    /**
     * @throws UnknownToolAgentException if no agent has this name
     */
    public boolean dispatch(String agentName, AgentSignal signal) {
        return get(agentName).handleSignal(signal);
    }

    public Collection<BaseToolAgent> getAgents() {
        return Collections.unmodifiableCollection(agentsByName.values());
    }
}
