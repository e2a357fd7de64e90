package com.z254.butterfly.scout.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Immutable registration of one agent in a run plan.
 */
@Value
@Builder(toBuilder = true)
public class AgentDescriptor {

    /**
     * Unique name within the plan.
     */
    String name;

    /**
     * Context path prefixes (relative to the run namespace) that must each hold at least one
     * entry before the agent can start. They must be written by the plan's seed values or by
     * other agents of the same run: once no agent is ready or running, an agent still waiting
     * on an empty prefix is skipped.
     */
    @Singular
    Set<String> readDependencies;

    /**
     * Agents whose terminal state gates this agent's start.
     */
    @Singular
    List<String> predecessors;

    /**
     * Predecessors whose failure or skip does not prevent this agent from running.
     */
    @Singular("tolerate")
    Set<String> tolerates;

    /**
     * Optional agents do not count towards the run's success.
     */
    boolean optional;

    /**
     * Overrides the plan's agent timeout when set.
     */
    Duration timeout;

    AgentTask task;

    public boolean toleratesFailureOf(String predecessor) {
        return tolerates.contains(predecessor);
    }
}
