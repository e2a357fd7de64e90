package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final report of a run, written to {@code report/summary}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditReport {

    private String repository;
    private Instant generatedAt;

    /**
     * CRITICAL, HIGH, MEDIUM, LOW, or UNKNOWN when no security analysis is available.
     */
    private String overallRiskLevel;

    private double codeQualityScore;
    private int totalFilesAnalyzed;
    private List<String> languages;
    private int endpointCount;
    private boolean securityAnalysisAvailable;
    private boolean codeReviewAvailable;
    private List<String> criticalFindings;
    private List<Recommendation> recommendations;

    /**
     * Keys {@code immediate_action}, {@code short_term} and {@code long_term}.
     */
    private Map<String, List<String>> priorityMatrix;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recommendation {
        private String category;
        private String priority;
        private String action;
    }
}
