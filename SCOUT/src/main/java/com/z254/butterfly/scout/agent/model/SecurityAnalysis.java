package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of the security analyst, written to {@code analysis/security}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityAnalysis {

    private Severity riskLevel;
    private double confidenceScore;
    private int filesScanned;
    private List<SecurityFinding> findings;

    /**
     * Findings rendered as text, most severe first.
     */
    private List<String> vulnerabilities;

    private List<String> dependencyManifests;
    private List<String> recommendations;
}
