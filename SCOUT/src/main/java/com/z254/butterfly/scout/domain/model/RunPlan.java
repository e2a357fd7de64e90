package com.z254.butterfly.scout.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Agents and options for a single orchestrated run. Unset options fall back to the
 * orchestrator defaults.
 */
@Value
@Builder(toBuilder = true)
public class RunPlan {

    /**
     * Run id; generated when absent. Also the context namespace of the run.
     */
    String runId;

    @Singular
    List<AgentDescriptor> agents;

    Integer maxConcurrency;
    Duration agentTimeout;
    Duration runTimeout;

    /**
     * Failed agents after which the rest of the run is skipped; 0 disables the threshold.
     */
    Integer maxFailures;

    /**
     * Values written under the run namespace before scheduling starts.
     */
    @Singular("seed")
    Map<String, Object> initialContext;
}
