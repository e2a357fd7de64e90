package com.z254.butterfly.scout.exception;

import java.util.Map;

/**
 * A run plan was rejected before any agent task started: duplicate or unknown agent names,
 * a cyclic predecessor graph, or invalid run options.
 */
public class OrchestrationSetupException extends ScoutException {

    public OrchestrationSetupException(String message) {
        super(message);
    }

    public OrchestrationSetupException(String message, Map<String, Object> details) {
        super(message, details);
    }
}
