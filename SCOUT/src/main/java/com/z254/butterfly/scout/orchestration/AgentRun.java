package com.z254.butterfly.scout.orchestration;

import com.z254.butterfly.scout.domain.model.LifecycleEvent;
import com.z254.butterfly.scout.domain.model.RunResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Handle to a submitted run.
 */
public interface AgentRun {

    String getRunId();

    /**
     * Completes with the aggregated result once every agent is terminal.
     */
    Mono<RunResult> result();

    /**
     * Every agent state transition of the run, replayed from the start for late subscribers.
     * Completes when the run finishes.
     */
    Flux<LifecycleEvent> lifecycle();
}
