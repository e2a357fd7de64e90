package com.z254.butterfly.scout.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.butterfly.scout.agent.model.AuditReport;
import com.z254.butterfly.scout.domain.model.RunState;
import com.z254.butterfly.scout.domain.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Status of an analysis run. Outcome fields are set once the run has finished.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisStatus {

    private String runId;
    private String repository;
    private RunStatus status;
    private Map<String, RunState> agentStates;
    private Instant startedAt;
    private Instant completedAt;

    private List<String> succeeded;
    private List<String> failed;
    private List<String> skipped;

    /**
     * Failure messages and skip reasons by agent name.
     */
    private Map<String, String> errors;

    private String cancellationReason;

    /**
     * The final report, when the reporter produced one.
     */
    private AuditReport report;
}
