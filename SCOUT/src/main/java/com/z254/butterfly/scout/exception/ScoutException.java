package com.z254.butterfly.scout.exception;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all SCOUT errors.
 * Carries an optional map of structured details for logging and API responses.
 */
public class ScoutException extends RuntimeException {

    private final Map<String, Object> details;

    public ScoutException(String message) {
        this(message, null, null);
    }

    public ScoutException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    public ScoutException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
