package com.z254.butterfly.scout.exception;

import java.time.Duration;

/**
 * An agent task did not finish within its timeout.
 */
public class AgentTimeoutException extends AgentExecutionException {

    public AgentTimeoutException(String agentName, Duration timeout) {
        super(agentName, "Agent " + agentName + " timed out after " + timeout.toMillis() + "ms", null);
    }
}
