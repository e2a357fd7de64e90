package com.z254.butterfly.scout.health;

import com.z254.butterfly.scout.context.InMemorySharedContextManager;
import com.z254.butterfly.scout.messaging.InMemoryMessageBroker;
import com.z254.butterfly.scout.observability.ScoutMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ScoutHealthIndicatorTest {

    private InMemoryMessageBroker broker;
    private InMemorySharedContextManager contextManager;
    private ScoutHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        broker = new InMemoryMessageBroker();
        contextManager = new InMemorySharedContextManager();
        healthIndicator = new ScoutHealthIndicator(broker, contextManager, new ScoutMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void shouldBeUpWithDetails() {
        contextManager.set("run-1/repo/files", "f", "test");

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("broker", "UP")
                            .containsEntry("activeRuns", 0)
                            .containsEntry("contextEntries", 1);
                })
                .verifyComplete();
    }

    @Test
    void shouldBeDownOnceBrokerIsShutDown() {
        broker.shutdown();

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
