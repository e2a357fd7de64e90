package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of a run, finished or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSnapshot {

    private String runId;
    private RunStatus status;
    private Map<String, RunState> agentStates;
    private Instant startedAt;

    /**
     * Present once the run has finished.
     */
    private RunResult result;

    public boolean isFinished() {
        return status != RunStatus.RUNNING;
    }
}
