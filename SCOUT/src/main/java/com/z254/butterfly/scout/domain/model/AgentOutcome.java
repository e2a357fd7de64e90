package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Final record of one agent in a finished run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentOutcome {

    private String agentName;
    private RunState state;

    /**
     * Failure message, or the derived reason for a skip.
     */
    private String error;

    private Object data;
    private boolean optional;
    private Instant startedAt;
    private Instant completedAt;

    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
