package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.domain.model.AgentDescriptor;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.RunPlan;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the run plan of a repository audit:
 * <pre>
 * repository_cloner -> security_analyst -+
 *                   -> code_reviewer    -+-> reporter
 * </pre>
 * The analysts wait for {@code repo/files}; the reporter tolerates the failure of either analyst.
 */
@Component
public class AuditPipeline {

    private static final Duration CLONE_MARGIN = Duration.ofMinutes(1);

    private final AgentRegistry agentRegistry;
    private final ScoutProperties scoutProperties;

    public AuditPipeline(AgentRegistry agentRegistry, ScoutProperties scoutProperties) {
        this.agentRegistry = agentRegistry;
        this.scoutProperties = scoutProperties;
    }

    /**
     * @param runId      run id, or null to generate one
     * @param repository local directory or git URL
     * @param options    analysis options, null for defaults
     */
    public RunPlan plan(String runId, String repository, AnalysisOptions options) {
        AnalysisOptions effective = options != null ? options : AnalysisOptions.defaults();
        String cloner = AuditAgentType.REPOSITORY_CLONER.getAgentName();
        String security = AuditAgentType.SECURITY_ANALYST.getAgentName();
        String reviewer = AuditAgentType.CODE_REVIEWER.getAgentName();

        RunPlan.RunPlanBuilder plan = RunPlan.builder()
                .runId(runId)
                .seed(AuditContextKeys.REQUEST_REPOSITORY, repository)
                .seed(AuditContextKeys.REQUEST_OPTIONS, effective)
                .agent(AgentDescriptor.builder()
                        .name(cloner)
                        .timeout(scoutProperties.getAnalysis().getCloneTimeout().plus(CLONE_MARGIN))
                        .task(agentRegistry.getAgent(AuditAgentType.REPOSITORY_CLONER))
                        .build())
                .agent(AgentDescriptor.builder()
                        .name(security)
                        .predecessor(cloner)
                        .readDependency(AuditContextKeys.REPO_FILES)
                        .task(agentRegistry.getAgent(AuditAgentType.SECURITY_ANALYST))
                        .build())
                .agent(AgentDescriptor.builder()
                        .name(reviewer)
                        .predecessor(cloner)
                        .readDependency(AuditContextKeys.REPO_FILES)
                        .task(agentRegistry.getAgent(AuditAgentType.CODE_REVIEWER))
                        .build())
                .agent(AgentDescriptor.builder()
                        .name(AuditAgentType.REPORTER.getAgentName())
                        .predecessor(security)
                        .predecessor(reviewer)
                        .tolerate(security)
                        .tolerate(reviewer)
                        .readDependency(AuditContextKeys.REPO_METADATA)
                        .task(agentRegistry.getAgent(AuditAgentType.REPORTER))
                        .build());
        if (!effective.isParallelExecution()) {
            plan.maxConcurrency(1);
        }
        return plan.build();
    }
}
