package com.z254.butterfly.scout.health;

import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.messaging.MessageBroker;
import com.z254.butterfly.scout.observability.ScoutMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for SCOUT service.
 * Reports the broker state, active runs, running agents and context size.
 */
@Component
@Slf4j
public class ScoutHealthIndicator implements ReactiveHealthIndicator {

    private final MessageBroker messageBroker;
    private final SharedContextManager contextManager;
    private final ScoutMetrics metrics;

    public ScoutHealthIndicator(MessageBroker messageBroker,
                                SharedContextManager contextManager,
                                ScoutMetrics metrics) {
        this.messageBroker = messageBroker;
        this.contextManager = contextManager;
        this.metrics = metrics;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    boolean brokerUp = !messageBroker.isShutdown();
                    Health.Builder builder = brokerUp ? Health.up() : Health.down();

                    builder.withDetail("broker", brokerUp ? "UP" : "DOWN");
                    builder.withDetail("activeRuns", metrics.getActiveRuns());
                    builder.withDetail("runningAgents", metrics.getRunningAgents());
                    builder.withDetail("contextEntries", contextManager.size());
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
