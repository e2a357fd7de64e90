package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Output of the code reviewer, written to {@code analysis/code_review}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeReview {

    /**
     * 0 to 10, higher is better.
     */
    private double maintainabilityScore;

    private List<String> bestPracticesViolations;
    private List<String> codeQualityIssues;
    private List<String> architectureRecommendations;
    private List<String> documentationGaps;
    private Map<String, Object> metrics;
}
