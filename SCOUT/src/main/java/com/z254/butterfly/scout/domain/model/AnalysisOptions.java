package com.z254.butterfly.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options of one repository analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOptions {

    /**
     * Review every code file instead of a sample.
     */
    private boolean deepAnalysis;

    /**
     * Include dependency manifests in the security analysis.
     */
    @Builder.Default
    private boolean includeDeps = true;

    /**
     * Run independent agents concurrently; false runs one agent at a time.
     */
    @Builder.Default
    private boolean parallelExecution = true;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
