package com.z254.butterfly.scout.observability;

import com.z254.butterfly.scout.domain.model.RunState;
import com.z254.butterfly.scout.domain.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized run and agent metrics for SCOUT.
 */
@Component
public class ScoutMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter runsStarted;
    private final Map<String, Counter> runsCompletedByStatus = new ConcurrentHashMap<>();
    private final Map<String, Counter> agentTasksByState = new ConcurrentHashMap<>();
    private final Timer agentTaskExecution;
    private final AtomicInteger runningAgents;
    private final AtomicInteger activeRuns;

    public ScoutMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsStarted = Counter.builder("scout.runs.started")
                .description("Runs started")
                .register(meterRegistry);
        this.agentTaskExecution = Timer.builder("scout.agent.task.execution")
                .description("Agent task execution time")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.runningAgents = meterRegistry.gauge("scout.agent.running", new AtomicInteger(0));
        this.activeRuns = meterRegistry.gauge("scout.runs.active", new AtomicInteger(0));
    }

    // ========== Run Methods ==========

    public void recordRunStarted() {
        runsStarted.increment();
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted(RunStatus status) {
        activeRuns.decrementAndGet();
        runsCompletedByStatus.computeIfAbsent(tagValue(status.name()), value ->
                Counter.builder("scout.runs.completed")
                        .tag("status", value)
                        .description("Runs completed by final status")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Agent Methods ==========

    public Timer.Sample startAgentTimer() {
        runningAgents.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    /**
     * Record the end of a task that was started with {@link #startAgentTimer()}.
     */
    public void recordAgentFinished(Timer.Sample sample) {
        sample.stop(agentTaskExecution);
        runningAgents.decrementAndGet();
    }

    public void recordAgentTerminal(RunState state) {
        agentTasksByState.computeIfAbsent(tagValue(state.name()), value ->
                Counter.builder("scout.agent.tasks")
                        .tag("state", value)
                        .description("Agents reaching a terminal state")
                        .register(meterRegistry))
                .increment();
    }

    public int getRunningAgents() {
        return runningAgents.get();
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
