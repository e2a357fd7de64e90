package com.z254.butterfly.scout.exception;

import java.util.Map;

public class RunNotFoundException extends ScoutException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId, Map.of("runId", runId));
    }
}
