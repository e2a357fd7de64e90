package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregated result of a finished run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private String runId;
    private RunStatus status;

    /**
     * Outcome per agent, in plan order.
     */
    private Map<String, AgentOutcome> outcomes;

    private String cancellationReason;
    private Instant startedAt;
    private Instant completedAt;

    /**
     * Context subtree of the run namespace at completion.
     */
    private Map<String, Object> context;

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    public boolean isCancelled() {
        return cancellationReason != null;
    }

    public List<String> getSucceeded() {
        return namesIn(RunState.SUCCEEDED);
    }

    public List<String> getFailed() {
        return namesIn(RunState.FAILED);
    }

    public List<String> getSkipped() {
        return namesIn(RunState.SKIPPED);
    }

    /**
     * Failure messages and skip reasons by agent name.
     */
    public Map<String, String> getErrors() {
        return outcomes.values().stream()
                .filter(o -> o.getError() != null)
                .collect(Collectors.toMap(AgentOutcome::getAgentName, AgentOutcome::getError,
                        (a, b) -> a, java.util.LinkedHashMap::new));
    }

    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    private List<String> namesIn(RunState state) {
        return outcomes.values().stream()
                .filter(o -> o.getState() == state)
                .map(AgentOutcome::getAgentName)
                .toList();
    }
}
