package com.z254.butterfly.scout.exception;

import java.util.Map;

/**
 * An agent task raised an error. Recorded as the agent's Failed result by the orchestrator.
 */
public class AgentExecutionException extends ScoutException {

    private final String agentName;

    public AgentExecutionException(String agentName, String message, Throwable cause) {
        super(message, Map.of("agent", agentName), cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
