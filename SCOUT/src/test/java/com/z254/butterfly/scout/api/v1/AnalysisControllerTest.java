package com.z254.butterfly.scout.api.v1;

import com.z254.butterfly.scout.api.dto.AnalysisRequest;
import com.z254.butterfly.scout.api.dto.AnalysisStatus;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.RunState;
import com.z254.butterfly.scout.domain.model.RunStatus;
import com.z254.butterfly.scout.exception.OrchestrationSetupException;
import com.z254.butterfly.scout.exception.RunNotFoundException;
import com.z254.butterfly.scout.service.AnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link AnalysisController}.
 */
@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private AnalysisService analysisService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new AnalysisController(analysisService)).build();
    }

    @Nested
    @DisplayName("POST /api/v1/analyses")
    class SubmitTests {

        @Test
        @DisplayName("should accept analysis and return run id")
        void acceptAnalysis() {
            when(analysisService.submit(eq("https://github.com/org/repo"), any())).thenReturn(Mono.just("run-1"));

            webTestClient.post()
                    .uri("/api/v1/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(AnalysisRequest.builder()
                            .repository("https://github.com/org/repo")
                            .parallelExecution(false)
                            .build())
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.runId").isEqualTo("run-1");

            ArgumentCaptor<AnalysisOptions> options = ArgumentCaptor.forClass(AnalysisOptions.class);
            verify(analysisService).submit(eq("https://github.com/org/repo"), options.capture());
            assertThat(options.getValue().isParallelExecution()).isFalse();
            assertThat(options.getValue().isIncludeDeps()).isTrue();
        }

        @Test
        @DisplayName("should reject blank repository")
        void rejectBlankRepository() {
            lenient().when(analysisService.submit(eq(""), any()))
                    .thenReturn(Mono.error(new IllegalArgumentException("Repository is required")));

            webTestClient.post()
                    .uri("/api/v1/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("repository", ""))
                    .exchange()
                    .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("should map setup errors to bad request")
        void mapSetupErrors() {
            when(analysisService.submit(anyString(), any()))
                    .thenReturn(Mono.error(new OrchestrationSetupException("Run already exists: run-1")));

            webTestClient.post()
                    .uri("/api/v1/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("repository", "/srv/repo"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("GET /api/v1/analyses/{runId}")
    class StatusTests {

        @Test
        @DisplayName("should return status")
        void returnStatus() {
            when(analysisService.getStatus("run-1")).thenReturn(Mono.just(AnalysisStatus.builder()
                    .runId("run-1")
                    .status(RunStatus.RUNNING)
                    .agentStates(Map.of("repository_cloner", RunState.RUNNING))
                    .build()));

            webTestClient.get()
                    .uri("/api/v1/analyses/run-1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("RUNNING")
                    .jsonPath("$.agentStates.repository_cloner").isEqualTo("RUNNING");
        }

        @Test
        @DisplayName("should return 404 for unknown run")
        void unknownRun() {
            when(analysisService.getStatus("missing")).thenReturn(Mono.error(new RunNotFoundException("missing")));

            webTestClient.get()
                    .uri("/api/v1/analyses/missing")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should return context tree")
        void returnContext() {
            when(analysisService.getContext("run-1"))
                    .thenReturn(Mono.just(Map.of("analysis_status", Map.of("reporter", "completed"))));

            webTestClient.get()
                    .uri("/api/v1/analyses/run-1/context")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.analysis_status.reporter").isEqualTo("completed");
        }
    }

    @Nested
    @DisplayName("DELETE /api/v1/analyses/{runId}")
    class CancelTests {

        @Test
        @DisplayName("should cancel with reason")
        void cancelWithReason() {
            when(analysisService.cancel("run-1", "obsolete")).thenReturn(Mono.just(true));

            webTestClient.delete()
                    .uri("/api/v1/analyses/run-1?reason=obsolete")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.cancelled").isEqualTo(true);
        }

        @Test
        @DisplayName("should return 404 for unknown run")
        void cancelUnknownRun() {
            when(analysisService.cancel(eq("missing"), anyString()))
                    .thenReturn(Mono.error(new RunNotFoundException("missing")));

            webTestClient.delete()
                    .uri("/api/v1/analyses/missing")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }
}
