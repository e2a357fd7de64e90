package com.z254.butterfly.scout.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of audit agents by type.
 */
@Component
@Slf4j
public class AgentRegistry {

    private final Map<AuditAgentType, AuditAgent> agents = new EnumMap<>(AuditAgentType.class);

    public AgentRegistry(List<AuditAgent> agentList) {
        for (AuditAgent agent : agentList) {
            if (agents.putIfAbsent(agent.getAgentType(), agent) != null) {
                throw new IllegalStateException("Duplicate audit agent for type: " + agent.getAgentType());
            }
            log.info("Registered audit agent: {}", agent.getAgentName());
        }
    }

    /**
     * Get the agent for a type.
     *
     * @param type the agent type
     * @return the agent
     * @throws IllegalArgumentException if no agent is registered for the type
     */
    public AuditAgent getAgent(AuditAgentType type) {
        AuditAgent agent = agents.get(type);
        if (agent == null) {
            throw new IllegalArgumentException("No audit agent registered for type: " + type);
        }
        return agent;
    }

    public boolean hasAgent(AuditAgentType type) {
        return agents.containsKey(type);
    }

    public Set<AuditAgentType> getRegisteredTypes() {
        return agents.keySet();
    }
}
