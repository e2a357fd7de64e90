package com.z254.butterfly.scout.api.dto;

import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a repository analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    @NotBlank(message = "Repository is required")
    @Size(max = 2048, message = "Repository must be less than 2048 characters")
    private String repository;

    private Boolean deepAnalysis;
    private Boolean includeDeps;
    private Boolean parallelExecution;

    /**
     * Convert to analysis options, unset flags taking their defaults.
     */
    public AnalysisOptions toOptions() {
        AnalysisOptions defaults = AnalysisOptions.defaults();
        return AnalysisOptions.builder()
                .deepAnalysis(deepAnalysis != null ? deepAnalysis : defaults.isDeepAnalysis())
                .includeDeps(includeDeps != null ? includeDeps : defaults.isIncludeDeps())
                .parallelExecution(parallelExecution != null ? parallelExecution : defaults.isParallelExecution())
                .build();
    }
}
