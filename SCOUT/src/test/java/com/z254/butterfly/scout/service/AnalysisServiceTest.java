package com.z254.butterfly.scout.service;

import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.AuditPipeline;
import com.z254.butterfly.scout.agent.GitRepositoryFetcher;
import com.z254.butterfly.scout.agent.model.AuditReport;
import com.z254.butterfly.scout.agent.model.RepoMetadata;
import com.z254.butterfly.scout.api.dto.AnalysisStatus;
import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.context.InMemorySharedContextManager;
import com.z254.butterfly.scout.domain.model.AgentOutcome;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.RunPlan;
import com.z254.butterfly.scout.domain.model.RunResult;
import com.z254.butterfly.scout.domain.model.RunSnapshot;
import com.z254.butterfly.scout.domain.model.RunState;
import com.z254.butterfly.scout.domain.model.RunStatus;
import com.z254.butterfly.scout.exception.RunNotFoundException;
import com.z254.butterfly.scout.orchestration.AgentOrchestrator;
import com.z254.butterfly.scout.orchestration.AgentRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AnalysisService}.
 */
@ExtendWith(MockitoExtension.class)
class AnalysisServiceTest {

    private static final String REPOSITORY = "https://github.com/org/repo.git";

    @Mock
    private AgentOrchestrator orchestrator;

    @Mock
    private AuditPipeline pipeline;

    @Mock
    private AgentRun run;

    @Mock
    private GitRepositoryFetcher fetcher;

    private InMemorySharedContextManager contextManager;
    private AnalysisService analysisService;

    @BeforeEach
    void setUp() {
        ScoutProperties properties = new ScoutProperties();
        properties.getAnalysis().setRetention(Duration.ofHours(24));
        contextManager = new InMemorySharedContextManager();
        analysisService = new AnalysisService(orchestrator, pipeline, contextManager, fetcher, properties);
    }

    @Nested
    @DisplayName("submit")
    class SubmitTests {

        @Test
        void shouldSubmitPlanAndReturnRunId() {
            // Given
            AnalysisOptions options = AnalysisOptions.builder().deepAnalysis(true).build();
            givenSubmittedRun("run-1", Instant.now());

            // When / Then
            StepVerifier.create(analysisService.submit(REPOSITORY, options))
                    .expectNext("run-1")
                    .verifyComplete();
            verify(pipeline).plan(isNull(), eq(REPOSITORY), eq(options));
        }

        @Test
        void shouldRejectBlankRepository() {
            StepVerifier.create(analysisService.submit("  ", AnalysisOptions.defaults()))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            verify(orchestrator, never()).submit(any());
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        void shouldIncludeOutcomeAndReport() {
            // Given
            RunResult result = RunResult.builder()
                    .runId("run-2")
                    .status(RunStatus.SUCCEEDED)
                    .outcomes(Map.of("reporter", AgentOutcome.builder()
                            .agentName("reporter").state(RunState.SUCCEEDED).build()))
                    .startedAt(Instant.now().minusSeconds(5))
                    .completedAt(Instant.now())
                    .build();
            when(orchestrator.getStatus("run-2")).thenReturn(Mono.just(RunSnapshot.builder()
                    .runId("run-2")
                    .status(RunStatus.SUCCEEDED)
                    .agentStates(Map.of("reporter", RunState.SUCCEEDED))
                    .result(result)
                    .build()));
            contextManager.scoped("run-2").set(AuditContextKeys.REPORT_SUMMARY,
                    AuditReport.builder().overallRiskLevel("LOW").build(), "reporter");

            // When
            AnalysisStatus status = analysisService.getStatus("run-2").block();

            // Then
            assertThat(status.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
            assertThat(status.getSucceeded()).containsExactly("reporter");
            assertThat(status.getCompletedAt()).isNotNull();
            assertThat(status.getReport().getOverallRiskLevel()).isEqualTo("LOW");
        }

        @Test
        void shouldReturnContextTreeOfRun() {
            when(orchestrator.getStatus("run-3")).thenReturn(Mono.just(RunSnapshot.builder()
                    .runId("run-3").status(RunStatus.RUNNING).build()));
            contextManager.set("run-3/repo/files", "f", "test");
            contextManager.set("run-4/repo/files", "other", "test");

            StepVerifier.create(analysisService.getContext("run-3"))
                    .assertNext(tree -> assertThat(tree).containsOnlyKeys("repo"))
                    .verifyComplete();
        }

        @Test
        void shouldPropagateUnknownRun() {
            when(orchestrator.getStatus("missing")).thenReturn(Mono.error(new RunNotFoundException("missing")));

            StepVerifier.create(analysisService.getStatus("missing"))
                    .expectError(RunNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("eviction")
    class EvictionTests {

        @Test
        void shouldEvictRunsFinishedBeforeRetention() {
            // Given
            Instant now = Instant.now();
            givenSubmittedRun("run-old", now.minus(Duration.ofHours(25)));
            analysisService.submit(REPOSITORY, null).block();
            contextManager.set("run-old/report/summary", "done", "reporter");
            when(orchestrator.forget("run-old")).thenReturn(true);

            // When
            int evicted = analysisService.evictExpired(now);

            // Then
            assertThat(evicted).isEqualTo(1);
            assertThat(contextManager.hasAny("run-old")).isFalse();
            assertThat(analysisService.evictExpired(now)).isZero();
        }

        @Test
        void shouldDeleteClonedWorkingTreeOnEviction() {
            // Given
            Instant now = Instant.now();
            givenSubmittedRun("run-cloned", now.minus(Duration.ofHours(25)));
            analysisService.submit(REPOSITORY, null).block();
            contextManager.scoped("run-cloned").set(AuditContextKeys.REPO_METADATA, RepoMetadata.builder()
                    .repository(REPOSITORY)
                    .localPath("/tmp/scout/repo-1234")
                    .cloned(true)
                    .build(), "repository_cloner");
            when(orchestrator.forget("run-cloned")).thenReturn(true);

            // When
            analysisService.evictExpired(now);

            // Then
            verify(fetcher).release(Paths.get("/tmp/scout/repo-1234"));
            assertThat(contextManager.hasAny("run-cloned")).isFalse();
        }

        @Test
        void shouldNotDeleteRepositoryAnalysedInPlace() {
            Instant now = Instant.now();
            givenSubmittedRun("run-local", now.minus(Duration.ofHours(25)));
            analysisService.submit(REPOSITORY, null).block();
            contextManager.scoped("run-local").set(AuditContextKeys.REPO_METADATA, RepoMetadata.builder()
                    .repository("/home/dev/project")
                    .localPath("/home/dev/project")
                    .cloned(false)
                    .build(), "repository_cloner");
            when(orchestrator.forget("run-local")).thenReturn(true);

            analysisService.evictExpired(now);

            verify(fetcher, never()).release(any());
        }

        @Test
        void shouldKeepRecentRuns() {
            Instant now = Instant.now();
            givenSubmittedRun("run-new", now.minus(Duration.ofHours(1)));
            analysisService.submit(REPOSITORY, null).block();

            assertThat(analysisService.evictExpired(now)).isZero();
            verify(orchestrator, never()).forget("run-new");
        }
    }

    private void givenSubmittedRun(String runId, Instant completedAt) {
        RunPlan plan = RunPlan.builder()
                .seed(AuditContextKeys.REQUEST_REPOSITORY, REPOSITORY)
                .build();
        when(pipeline.plan(isNull(), eq(REPOSITORY), any())).thenReturn(plan);
        when(orchestrator.submit(plan)).thenReturn(Mono.just(run));
        when(run.getRunId()).thenReturn(runId);
        when(run.result()).thenReturn(Mono.just(RunResult.builder()
                .runId(runId)
                .status(RunStatus.SUCCEEDED)
                .completedAt(completedAt)
                .build()));
    }
}
