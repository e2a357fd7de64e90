package com.z254.butterfly.scout.api.v1;

import com.z254.butterfly.scout.api.dto.AnalysisRequest;
import com.z254.butterfly.scout.api.dto.AnalysisStatus;
import com.z254.butterfly.scout.api.dto.AnalysisSubmission;
import com.z254.butterfly.scout.exception.OrchestrationSetupException;
import com.z254.butterfly.scout.exception.RunNotFoundException;
import com.z254.butterfly.scout.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for repository analyses.
 */
@RestController
@RequestMapping("/api/v1/analyses")
@Tag(name = "Analyses", description = "Repository audit runs")
@Slf4j
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    @Operation(summary = "Submit analysis", description = "Start an audit of a local directory or git repository")
    @ApiResponse(responseCode = "202", description = "Analysis submitted")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    public Mono<ResponseEntity<AnalysisSubmission>> submit(@Valid @RequestBody AnalysisRequest request) {
        log.info("Submitting analysis of {}", request.getRepository());

        return analysisService.submit(request.getRepository(), request.toOptions())
                .map(runId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(new AnalysisSubmission(runId)))
                .onErrorResume(OrchestrationSetupException.class, e -> Mono.just(ResponseEntity.badRequest().build()))
                .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get analysis", description = "Agent states, outcome and report of an analysis")
    @ApiResponse(responseCode = "200", description = "Analysis found")
    @ApiResponse(responseCode = "404", description = "Analysis not found")
    public Mono<ResponseEntity<AnalysisStatus>> getStatus(
            @Parameter(description = "Run ID") @PathVariable String runId) {

        return analysisService.getStatus(runId)
                .map(ResponseEntity::ok)
                .onErrorResume(RunNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    @GetMapping("/{runId}/context")
    @Operation(summary = "Get analysis context", description = "The shared context written by the analysis agents")
    @ApiResponse(responseCode = "200", description = "Context found")
    @ApiResponse(responseCode = "404", description = "Analysis not found")
    public Mono<ResponseEntity<Map<String, Object>>> getContext(
            @Parameter(description = "Run ID") @PathVariable String runId) {

        return analysisService.getContext(runId)
                .map(ResponseEntity::ok)
                .onErrorResume(RunNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }

    @DeleteMapping("/{runId}")
    @Operation(summary = "Cancel analysis", description = "Cancel a running analysis")
    @ApiResponse(responseCode = "200", description = "Cancellation processed")
    @ApiResponse(responseCode = "404", description = "Analysis not found")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(
            @Parameter(description = "Run ID") @PathVariable String runId,
            @RequestParam(required = false) String reason) {
        log.info("Cancelling analysis {}: {}", runId, reason);

        return analysisService.cancel(runId, reason != null ? reason : "cancelled by user")
                .map(cancelled -> ResponseEntity.ok(Map.<String, Object>of("runId", runId, "cancelled", cancelled)))
                .onErrorResume(RunNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }
}
