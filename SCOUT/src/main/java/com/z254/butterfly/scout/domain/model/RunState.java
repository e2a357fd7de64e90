package com.z254.butterfly.scout.domain.model;

/**
 * State of one agent within a run. Written only by the orchestrator.
 */
public enum RunState {

    /**
     * Waiting for predecessors or context dependencies.
     */
    PENDING,

    /**
     * All dependencies satisfied, queued for a worker.
     */
    READY,

    RUNNING,

    SUCCEEDED,

    FAILED,

    /**
     * Never ran: a required predecessor failed, a dependency was never satisfied,
     * or the run was cancelled.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
