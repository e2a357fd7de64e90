package com.z254.butterfly.scout.agent.impl;

import com.z254.butterfly.scout.agent.AuditAgent;
import com.z254.butterfly.scout.agent.AuditAgentType;
import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.model.AuditReport;
import com.z254.butterfly.scout.agent.model.CodeReview;
import com.z254.butterfly.scout.agent.model.RepoMetadata;
import com.z254.butterfly.scout.agent.model.SecurityAnalysis;
import com.z254.butterfly.scout.agent.model.Severity;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.TaskResult;
import com.z254.butterfly.scout.messaging.MessageBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Reporter agent.
 * Combines whatever analyses are available into the final report. Either analysis may be
 * missing when its agent failed; the report then says so instead of failing.
 */
@Component
@Slf4j
public class ReporterAgent implements AuditAgent {

    public static final String UNKNOWN_RISK = "UNKNOWN";

    @Override
    public AuditAgentType getAgentType() {
        return AuditAgentType.REPORTER;
    }

    @Override
    public TaskResult runTask(String agentName, SharedContextManager context, MessageBroker broker) {
        RepoMetadata metadata = context.get(AuditContextKeys.REPO_METADATA, RepoMetadata.class).orElse(null);
        SecurityAnalysis security = context.get(AuditContextKeys.ANALYSIS_SECURITY, SecurityAnalysis.class).orElse(null);
        CodeReview review = context.get(AuditContextKeys.ANALYSIS_CODE_REVIEW, CodeReview.class).orElse(null);
        int endpoints = context.get(AuditContextKeys.REPO_ENDPOINTS, List.class).map(List::size).orElse(0);

        AuditReport report = buildReport(metadata, security, review, endpoints);
        context.set(AuditContextKeys.REPORT_SUMMARY, report, agentName);

        log.info("Report generated for {}: risk {}, quality {}",
                report.getRepository(), report.getOverallRiskLevel(), report.getCodeQualityScore());
        return TaskResult.success(Map.of(
                "overallRiskLevel", report.getOverallRiskLevel(),
                "codeQualityScore", report.getCodeQualityScore()));
    }

    static AuditReport buildReport(RepoMetadata metadata, SecurityAnalysis security, CodeReview review, int endpoints) {
        return AuditReport.builder()
                .repository(metadata != null ? metadata.getRepository() : null)
                .generatedAt(Instant.now())
                .overallRiskLevel(overallRisk(security, review))
                .codeQualityScore(overallQuality(security, review))
                .totalFilesAnalyzed(metadata != null ? metadata.getFileCount() : 0)
                .languages(metadata != null ? metadata.getLanguages() : List.of())
                .endpointCount(endpoints)
                .securityAnalysisAvailable(security != null)
                .codeReviewAvailable(review != null)
                .criticalFindings(criticalFindings(security, review))
                .recommendations(recommendations(security, review))
                .priorityMatrix(priorityMatrix(security, review))
                .build();
    }

    static String overallRisk(SecurityAnalysis security, CodeReview review) {
        if (security == null) {
            return UNKNOWN_RISK;
        }
        int rank = security.getRiskLevel() != null ? security.getRiskLevel().getRank() : Severity.MEDIUM.getRank();
        if (review != null && review.getMaintainabilityScore() < 3) {
            rank = Math.min(rank + 1, Severity.CRITICAL.getRank());
        }
        return Severity.ofRank(rank).name();
    }

    static double overallQuality(SecurityAnalysis security, CodeReview review) {
        if (review == null) {
            return 5.0;
        }
        double score = review.getMaintainabilityScore();
        if (security != null && security.getRiskLevel() == Severity.CRITICAL) {
            score = Math.max(score - 2, 0);
        } else if (security != null && security.getRiskLevel() == Severity.HIGH) {
            score = Math.max(score - 1, 0);
        }
        return Math.round(score * 10.0) / 10.0;
    }

    static List<String> criticalFindings(SecurityAnalysis security, CodeReview review) {
        List<String> findings = new ArrayList<>();
        if (security != null) {
            findings.addAll(first(security.getVulnerabilities(), 3));
        }
        if (review != null) {
            findings.addAll(first(review.getBestPracticesViolations(), 3));
        }
        return first(findings, 5);
    }

    static List<AuditReport.Recommendation> recommendations(SecurityAnalysis security, CodeReview review) {
        List<AuditReport.Recommendation> recommendations = new ArrayList<>();
        if (security != null) {
            first(security.getRecommendations(), 3).forEach(action ->
                    recommendations.add(new AuditReport.Recommendation("Security", "HIGH", action)));
        }
        if (review != null) {
            first(review.getArchitectureRecommendations(), 3).forEach(action ->
                    recommendations.add(new AuditReport.Recommendation("Code Quality", "MEDIUM", action)));
        }
        return recommendations;
    }

    static Map<String, List<String>> priorityMatrix(SecurityAnalysis security, CodeReview review) {
        Map<String, List<String>> matrix = new LinkedHashMap<>();
        matrix.put("immediate_action", new ArrayList<>());
        matrix.put("short_term", new ArrayList<>());
        matrix.put("long_term", new ArrayList<>());
        if (security != null && security.getRiskLevel() != null
                && security.getRiskLevel().getRank() >= Severity.HIGH.getRank()) {
            matrix.get("immediate_action").addAll(first(security.getVulnerabilities(), 2));
        }
        if (review != null && review.getMaintainabilityScore() < 4) {
            matrix.get("short_term").addAll(first(review.getBestPracticesViolations(), 2));
        }
        if (review != null) {
            matrix.get("long_term").addAll(first(review.getArchitectureRecommendations(), 2));
        }
        return matrix;
    }

    private static <T> List<T> first(List<T> values, int limit) {
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values.subList(0, Math.min(limit, values.size())));
    }
}
