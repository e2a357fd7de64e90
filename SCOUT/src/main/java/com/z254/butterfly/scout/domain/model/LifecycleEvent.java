package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One state transition of one agent in a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEvent {

    private String runId;
    private String agentName;
    private RunState from;
    private RunState to;
    private String detail;
    private Instant timestamp;

    public static LifecycleEvent transition(String runId, String agentName, RunState from, RunState to, String detail) {
        return LifecycleEvent.builder()
                .runId(runId)
                .agentName(agentName)
                .from(from)
                .to(to)
                .detail(detail)
                .timestamp(Instant.now())
                .build();
    }
}
