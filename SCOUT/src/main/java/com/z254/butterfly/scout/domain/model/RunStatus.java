package com.z254.butterfly.scout.domain.model;

/**
 * Overall status of a run.
 */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}
