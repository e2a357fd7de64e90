package com.z254.butterfly.scout.domain.model;

import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.messaging.MessageBroker;

/**
 * Unit of work run by the orchestrator for one agent.
 * <p>
 * Implementations may block while waiting on a context watch or a broker message. A thrown
 * exception is recorded as a failure of the agent.
 */
@FunctionalInterface
public interface AgentTask {

    /**
     * @param agentName name the agent was registered under
     * @param context   context view rooted at the run's namespace
     * @param broker    the process-wide broker
     * @return the task outcome; {@code null} is treated as a failure
     */
    TaskResult runTask(String agentName, SharedContextManager context, MessageBroker broker) throws Exception;
}
