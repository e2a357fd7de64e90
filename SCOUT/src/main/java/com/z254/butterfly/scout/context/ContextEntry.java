package com.z254.butterfly.scout.context;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A committed value in the shared context.
 * The version starts at 1 and increases by one on every write to the same path.
 */
@Value
@Builder(toBuilder = true)
public class ContextEntry {

    ContextPath path;

    Object value;

    long version;

    /**
     * Identity of the agent (or component) that performed the write.
     */
    String writer;

    Instant updatedAt;

    public String getPathString() {
        return path.toString();
    }
}
