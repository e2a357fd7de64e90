package com.z254.butterfly.scout.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.scout.agent.impl.CodeReviewerAgent;
import com.z254.butterfly.scout.agent.impl.ReporterAgent;
import com.z254.butterfly.scout.agent.impl.RepositoryClonerAgent;
import com.z254.butterfly.scout.agent.impl.SecurityAnalystAgent;
import com.z254.butterfly.scout.agent.model.AuditReport;
import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.context.InMemorySharedContextManager;
import com.z254.butterfly.scout.domain.model.AgentDescriptor;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.RunPlan;
import com.z254.butterfly.scout.domain.model.RunResult;
import com.z254.butterfly.scout.domain.model.RunStatus;
import com.z254.butterfly.scout.messaging.AgentMessage;
import com.z254.butterfly.scout.messaging.InMemoryMessageBroker;
import com.z254.butterfly.scout.observability.ScoutMetrics;
import com.z254.butterfly.scout.observability.StructuredLogger;
import com.z254.butterfly.scout.orchestration.AgentOrchestratorImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the audit agents through the orchestrator against a local repository.
 */
class AuditPipelineTest {

    private static final Duration WAIT = Duration.ofSeconds(30);

    @TempDir
    Path repo;

    private InMemorySharedContextManager contextManager;
    private InMemoryMessageBroker broker;
    private AgentOrchestratorImpl orchestrator;
    private AuditPipeline pipeline;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        StructuredLogger structuredLogger = new StructuredLogger(objectMapper);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        ScoutProperties properties = new ScoutProperties();
        properties.getAnalysis().setWorkspaceDir(repo.resolveSibling(repo.getFileName() + "-clones").toString());

        contextManager = new InMemorySharedContextManager(objectMapper, meterRegistry);
        broker = new InMemoryMessageBroker(properties, meterRegistry, structuredLogger);
        orchestrator = new AgentOrchestratorImpl(contextManager, broker, properties,
                new ScoutMetrics(meterRegistry), structuredLogger);

        RepositoryScanner scanner = new RepositoryScanner(properties);
        AgentRegistry registry = new AgentRegistry(List.of(
                new RepositoryClonerAgent(new GitRepositoryFetcher(properties), scanner),
                new SecurityAnalystAgent(scanner),
                new CodeReviewerAgent(scanner),
                new ReporterAgent()));
        pipeline = new AuditPipeline(registry, properties);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        broker.shutdown();
        contextManager.close();
    }

    @Test
    void shouldWireAgentsIntoDependencyOrder() {
        RunPlan plan = pipeline.plan("run-plan", repo.toString(), AnalysisOptions.defaults());

        assertThat(plan.getAgents()).extracting(AgentDescriptor::getName)
                .containsExactly("repository_cloner", "security_analyst", "code_reviewer", "reporter");
        AgentDescriptor reporter = plan.getAgents().get(3);
        assertThat(reporter.getPredecessors()).containsExactly("security_analyst", "code_reviewer");
        assertThat(reporter.getTolerates()).containsExactlyInAnyOrder("security_analyst", "code_reviewer");
        assertThat(plan.getMaxConcurrency()).isNull();
        assertThat(plan.getInitialContext()).containsEntry(AuditContextKeys.REQUEST_REPOSITORY, repo.toString());
    }

    @Test
    void shouldRunOneAgentAtATimeWithoutParallelExecution() {
        RunPlan plan = pipeline.plan(null, repo.toString(),
                AnalysisOptions.builder().parallelExecution(false).build());

        assertThat(plan.getMaxConcurrency()).isEqualTo(1);
    }

    @Test
    void shouldAuditLocalRepository() throws IOException {
        // Given
        write("README.md", "# Service\n");
        write("app.py", "from flask import Flask\napp = Flask(__name__)\n\n@app.route('/login')\ndef login():\n"
                + "    password = \"supersecret\"\n    return 'ok'\n");
        write("tests/test_app.py", "def test_login():\n    assert True\n");
        write("requirements.txt", "flask==3.0.0\n");

        // When
        RunResult result = orchestrator.execute(pipeline.plan("run-audit", repo.toString(), AnalysisOptions.defaults()))
                .block(WAIT);

        // Then
        assertThat(result).isNotNull();
        assertThat(result.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.getSucceeded())
                .containsExactly("repository_cloner", "security_analyst", "code_reviewer", "reporter");

        AuditReport report = contextManager.scoped("run-audit")
                .get(AuditContextKeys.REPORT_SUMMARY, AuditReport.class).orElseThrow();
        assertThat(report.getOverallRiskLevel()).isEqualTo("HIGH");
        assertThat(report.getEndpointCount()).isEqualTo(1);
        assertThat(report.getTotalFilesAnalyzed()).isEqualTo(4);
        assertThat(report.isSecurityAnalysisAvailable()).isTrue();
        assertThat(report.isCodeReviewAvailable()).isTrue();
        assertThat(report.getCriticalFindings()).anyMatch(finding -> finding.contains("Hardcoded password"));
        assertThat(result.getContext())
                .containsEntry("analysis_status/reporter", "completed")
                .containsKeys("repo/metadata", "repo/files", "repo/endpoints",
                        "analysis/security", "analysis/code_review", "report/summary");

        List<AgentMessage> ready = broker.history("repository_cloner", null, AuditContextKeys.TOPIC_REPO_READY);
        assertThat(ready).hasSize(1);
    }

    @Test
    void shouldSkipDownstreamAgentsWhenRepositoryCannotBeResolved() {
        RunResult result = orchestrator.execute(
                        pipeline.plan("run-missing", repo.resolve("missing").toString(), AnalysisOptions.defaults()))
                .block(WAIT);

        assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(result.getFailed()).containsExactly("repository_cloner");
        assertThat(result.getSkipped()).containsExactly("security_analyst", "code_reviewer", "reporter");
        assertThat(result.getErrors())
                .containsEntry("security_analyst", "predecessor repository_cloner FAILED")
                .containsEntry("reporter", "context dependency repo/metadata never satisfied");
        assertThat(result.getErrors().get("repository_cloner")).contains("neither a directory nor a git URL");
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
