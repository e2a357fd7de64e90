package com.z254.butterfly.scout.exception;

import java.util.Map;

/**
 * A context path could not be parsed.
 */
public class ContextPathException extends ScoutException {

    public ContextPathException(String message, String path) {
        super(message, Map.of("path", String.valueOf(path)));
    }
}
