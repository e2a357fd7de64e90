package com.z254.butterfly.scout.orchestration;

import com.z254.butterfly.scout.domain.model.LifecycleEvent;
import com.z254.butterfly.scout.domain.model.RunPlan;
import com.z254.butterfly.scout.domain.model.RunResult;
import com.z254.butterfly.scout.domain.model.RunSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Drives the agents of a run plan through their lifecycle according to declared predecessors
 * and context dependencies.
 *
 * <p>A run ends once every agent is terminal. Context read dependencies are only awaited while
 * some agent of the run can still write them; writers outside the run are not waited for, so a
 * dependency no agent or seed value provides leads to a skip.
 */
public interface AgentOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Run Execution
    // --------------------------------------------------------------------------------------------

    /**
     * Validate a plan and start it.
     *
     * @param plan The agents and run options
     * @return Handle to the started run, or an
     *         {@link com.z254.butterfly.scout.exception.OrchestrationSetupException} if the plan
     *         is rejected; no task has started in that case
     */
    Mono<AgentRun> submit(RunPlan plan);

    /**
     * Submit a plan and wait for its result.
     *
     * @param plan The agents and run options
     * @return The aggregated result of the run
     */
    Mono<RunResult> execute(RunPlan plan);

    /**
     * Cancel a running run. Every non-terminal agent becomes Skipped and the run fails with
     * the given reason.
     *
     * @param runId  The run ID
     * @param reason The cancellation reason
     * @return true if the run was still running, false if it had already finished
     */
    Mono<Boolean> cancel(String runId, String reason);

    // --------------------------------------------------------------------------------------------
    // Run Queries
    // --------------------------------------------------------------------------------------------

    /**
     * @return Current states of the run, or a
     *         {@link com.z254.butterfly.scout.exception.RunNotFoundException}
     */
    Mono<RunSnapshot> getStatus(String runId);

    /**
     * @return The result once the run has finished
     */
    Mono<RunResult> getResult(String runId);

    Flux<LifecycleEvent> lifecycle(String runId);

    Set<String> getActiveRuns();

    /**
     * Drop a finished run from the orchestrator's registry.
     *
     * @return true if a finished run was removed
     */
    boolean forget(String runId);

    Map<String, Object> getStats();
}
