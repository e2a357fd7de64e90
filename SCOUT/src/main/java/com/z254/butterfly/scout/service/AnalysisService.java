package com.z254.butterfly.scout.service;

import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.AuditPipeline;
import com.z254.butterfly.scout.agent.GitRepositoryFetcher;
import com.z254.butterfly.scout.agent.model.AuditReport;
import com.z254.butterfly.scout.agent.model.RepoMetadata;
import com.z254.butterfly.scout.api.dto.AnalysisStatus;
import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.RunPlan;
import com.z254.butterfly.scout.domain.model.RunResult;
import com.z254.butterfly.scout.domain.model.RunSnapshot;
import com.z254.butterfly.scout.orchestration.AgentOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Repository analysis operations on top of the orchestrator: submission of audit runs,
 * status and context queries, cancellation and eviction of expired runs.
 */
@Service
@Slf4j
public class AnalysisService {

    private final AgentOrchestrator orchestrator;
    private final AuditPipeline pipeline;
    private final SharedContextManager contextManager;
    private final GitRepositoryFetcher fetcher;
    private final Duration retention;

    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();

    public AnalysisService(
            AgentOrchestrator orchestrator,
            AuditPipeline pipeline,
            SharedContextManager contextManager,
            GitRepositoryFetcher fetcher,
            ScoutProperties scoutProperties) {
        this.orchestrator = orchestrator;
        this.pipeline = pipeline;
        this.contextManager = contextManager;
        this.fetcher = fetcher;
        this.retention = scoutProperties.getAnalysis().getRetention();
    }

    /**
     * Submit an analysis.
     *
     * @param repository local directory or git URL
     * @param options    analysis options, null for defaults
     * @return the run id
     */
    public Mono<String> submit(String repository, AnalysisOptions options) {
        if (repository == null || repository.isBlank()) {
            return Mono.error(new IllegalArgumentException("Repository is required"));
        }
        return Mono.fromCallable(() -> pipeline.plan(null, repository.trim(), options))
                .flatMap(this::submit)
                .doOnNext(runId -> log.info("Submitted analysis {} of {}", runId, repository));
    }

    private Mono<String> submit(RunPlan plan) {
        return orchestrator.submit(plan).map(run -> {
            Submission submission = new Submission((String) plan.getInitialContext()
                    .get(AuditContextKeys.REQUEST_REPOSITORY));
            submissions.put(run.getRunId(), submission);
            run.result().subscribe(
                    result -> submission.completedAt = result.getCompletedAt() != null
                            ? result.getCompletedAt() : Instant.now(),
                    error -> {
                        log.warn("Analysis {} ended with an error: {}", run.getRunId(), error.getMessage());
                        submission.completedAt = Instant.now();
                    });
            return run.getRunId();
        });
    }

    public Mono<AnalysisStatus> getStatus(String runId) {
        return orchestrator.getStatus(runId).map(this::toStatus);
    }

    /**
     * The run's context subtree as nested maps.
     */
    public Mono<Map<String, Object>> getContext(String runId) {
        return orchestrator.getStatus(runId).map(snapshot -> contextManager.getTree(runId));
    }

    /**
     * @return true if the run was still running and is now cancelled
     */
    public Mono<Boolean> cancel(String runId, String reason) {
        return orchestrator.cancel(runId, reason)
                .doOnNext(cancelled -> log.info("Cancel analysis {}: {}", runId, cancelled ? "cancelled" : "already finished"));
    }

    @Scheduled(fixedDelayString = "${scout.analysis.eviction-interval:PT10M}")
    public void evictExpired() {
        evictExpired(Instant.now());
    }

    /**
     * Forget runs that finished before {@code now - retention}, remove their context and delete
     * the working trees they cloned.
     *
     * @return number of evicted runs
     */
    int evictExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        for (Map.Entry<String, Submission> entry : submissions.entrySet()) {
            Instant completedAt = entry.getValue().completedAt;
            if (completedAt == null || completedAt.isAfter(cutoff)) {
                continue;
            }
            String runId = entry.getKey();
            if (orchestrator.forget(runId)) {
                contextManager.scoped(runId)
                        .get(AuditContextKeys.REPO_METADATA, RepoMetadata.class)
                        .filter(RepoMetadata::isCloned)
                        .ifPresent(metadata -> fetcher.release(Paths.get(metadata.getLocalPath())));
                int removed = contextManager.remove(runId);
                submissions.remove(runId);
                evicted++;
                log.debug("Evicted analysis {} ({} context entries)", runId, removed);
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} expired analyses", evicted);
        }
        return evicted;
    }

    private AnalysisStatus toStatus(RunSnapshot snapshot) {
        Submission submission = submissions.get(snapshot.getRunId());
        AnalysisStatus.AnalysisStatusBuilder status = AnalysisStatus.builder()
                .runId(snapshot.getRunId())
                .repository(submission != null ? submission.repository : null)
                .status(snapshot.getStatus())
                .agentStates(snapshot.getAgentStates())
                .startedAt(snapshot.getStartedAt());
        RunResult result = snapshot.getResult();
        if (result != null) {
            status.completedAt(result.getCompletedAt())
                    .succeeded(result.getSucceeded())
                    .failed(result.getFailed())
                    .skipped(result.getSkipped())
                    .errors(result.getErrors())
                    .cancellationReason(result.getCancellationReason());
        }
        contextManager.scoped(snapshot.getRunId())
                .get(AuditContextKeys.REPORT_SUMMARY, AuditReport.class)
                .ifPresent(status::report);
        return status.build();
    }

    private static final class Submission {
        private final String repository;
        private volatile Instant completedAt;

        private Submission(String repository) {
            this.repository = repository;
        }
    }
}
