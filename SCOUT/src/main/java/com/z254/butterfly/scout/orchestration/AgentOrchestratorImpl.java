package com.z254.butterfly.scout.orchestration;

import com.z254.butterfly.scout.config.ScoutProperties;
import com.z254.butterfly.scout.context.ContextPath;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.LifecycleEvent;
import com.z254.butterfly.scout.domain.model.RunPlan;
import com.z254.butterfly.scout.domain.model.RunResult;
import com.z254.butterfly.scout.domain.model.RunSnapshot;
import com.z254.butterfly.scout.domain.model.RunStatus;
import com.z254.butterfly.scout.exception.ContextPathException;
import com.z254.butterfly.scout.exception.OrchestrationSetupException;
import com.z254.butterfly.scout.exception.RunNotFoundException;
import com.z254.butterfly.scout.messaging.MessageBroker;
import com.z254.butterfly.scout.observability.ScoutMetrics;
import com.z254.butterfly.scout.observability.StructuredLogger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Implementation of the AgentOrchestrator interface.
 * <p>
 * All runs share one single-threaded loop scheduler for state transitions and one bounded
 * worker pool for agent tasks. Each run's agents see the shared context through a view rooted
 * at the run id.
 */
@Service
@Slf4j
public class AgentOrchestratorImpl implements AgentOrchestrator {

    private final SharedContextManager contextManager;
    private final MessageBroker messageBroker;
    private final ScoutProperties.OrchestratorProperties defaults;
    private final ScoutMetrics metrics;
    private final StructuredLogger structuredLogger;

    private final Scheduler loop;
    private final Scheduler workers;

    private final Map<String, RunExecution> runs = new ConcurrentHashMap<>();

    public AgentOrchestratorImpl(
            SharedContextManager contextManager,
            MessageBroker messageBroker,
            ScoutProperties scoutProperties,
            ScoutMetrics metrics,
            StructuredLogger structuredLogger) {
        this.contextManager = contextManager;
        this.messageBroker = messageBroker;
        this.defaults = scoutProperties.getOrchestrator();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.loop = Schedulers.newSingle("scout-orchestrator", true);
        this.workers = Schedulers.newBoundedElastic(
                Math.max(1, defaults.getWorkerPoolSize()),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "scout-agent",
                60,
                true);
        log.info("Initialized AgentOrchestrator (worker pool {}, default max concurrency {})",
                defaults.getWorkerPoolSize(), defaults.getMaxConcurrency());
    }

    // --------------------------------------------------------------------------------------------
    // Run Execution
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<AgentRun> submit(RunPlan plan) {
        return Mono.fromCallable(() -> prepare(plan))
                .map(execution -> {
                    if (runs.putIfAbsent(execution.getRunId(), execution) != null) {
                        throw new OrchestrationSetupException("Run already exists: " + execution.getRunId(),
                                Map.of("runId", execution.getRunId()));
                    }
                    execution.start();
                    log.info("Submitted run: {}", execution.getRunId());
                    return (AgentRun) execution;
                })
                .doOnError(OrchestrationSetupException.class,
                        e -> log.warn("Rejected run plan: {}", e.getMessage()));
    }

    @Override
    public Mono<RunResult> execute(RunPlan plan) {
        return submit(plan).flatMap(AgentRun::result);
    }

    @Override
    public Mono<Boolean> cancel(String runId, String reason) {
        return findRun(runId).flatMap(execution -> execution.cancel(reason != null ? reason : "cancelled by request"));
    }

    // --------------------------------------------------------------------------------------------
    // Run Queries
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<RunSnapshot> getStatus(String runId) {
        return findRun(runId).map(RunExecution::snapshot);
    }

    @Override
    public Mono<RunResult> getResult(String runId) {
        return findRun(runId).flatMap(RunExecution::result);
    }

    @Override
    public Flux<LifecycleEvent> lifecycle(String runId) {
        return findRun(runId).flatMapMany(RunExecution::lifecycle);
    }

    @Override
    public Set<String> getActiveRuns() {
        return runs.values().stream()
                .filter(execution -> !execution.isFinished())
                .map(RunExecution::getRunId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public boolean forget(String runId) {
        RunExecution execution = runs.get(runId);
        if (execution == null || !execution.isFinished()) {
            return false;
        }
        return runs.remove(runId, execution);
    }

    /**
     * Get statistics about the orchestrator.
     */
    @Override
    public Map<String, Object> getStats() {
        Map<RunStatus, Long> byStatus = runs.values().stream()
                .collect(Collectors.groupingBy(RunExecution::getStatus, () -> new EnumMap<>(RunStatus.class),
                        Collectors.counting()));
        Map<String, Object> stats = new HashMap<>();
        stats.put("trackedRuns", runs.size());
        stats.put("activeRuns", byStatus.getOrDefault(RunStatus.RUNNING, 0L));
        stats.put("succeededRuns", byStatus.getOrDefault(RunStatus.SUCCEEDED, 0L));
        stats.put("failedRuns", byStatus.getOrDefault(RunStatus.FAILED, 0L));
        stats.put("runningAgents", metrics.getRunningAgents());
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        Flux.fromIterable(runs.values())
                .filter(execution -> !execution.isFinished())
                .flatMap(execution -> execution.cancel("orchestrator shutting down"))
                .then()
                .timeout(Duration.ofSeconds(5), Mono.empty())
                .block();
        loop.dispose();
        workers.dispose();
        log.info("Agent orchestrator shut down");
    }

    // --------------------------------------------------------------------------------------------
    // Validation and Preparation
    // --------------------------------------------------------------------------------------------

    private RunExecution prepare(RunPlan plan) {
        if (plan == null) {
            throw new OrchestrationSetupException("Run plan is required");
        }
        DependencyGraph graph = DependencyGraph.build(plan.getAgents());

        int maxConcurrency = plan.getMaxConcurrency() != null ? plan.getMaxConcurrency() : defaults.getMaxConcurrency();
        if (maxConcurrency < 1) {
            throw new OrchestrationSetupException("Max concurrency must be at least 1: " + maxConcurrency,
                    Map.of("maxConcurrency", maxConcurrency));
        }
        int maxFailures = plan.getMaxFailures() != null ? plan.getMaxFailures() : defaults.getMaxFailures();
        if (maxFailures < 0) {
            throw new OrchestrationSetupException("Max failures must not be negative: " + maxFailures,
                    Map.of("maxFailures", maxFailures));
        }
        Duration agentTimeout = plan.getAgentTimeout() != null ? plan.getAgentTimeout() : defaults.getAgentTimeout();
        Duration runTimeout = plan.getRunTimeout() != null ? plan.getRunTimeout() : defaults.getRunTimeout();

        String runId = plan.getRunId() != null ? plan.getRunId() : UUID.randomUUID().toString();
        ContextPath namespace = parse(runId, "Invalid run id");
        if (namespace.isRoot() || namespace.depth() != 1) {
            throw new OrchestrationSetupException("Run id must be a single path segment: " + runId,
                    Map.of("runId", runId));
        }

        Map<String, Object> seed = new LinkedHashMap<>();
        plan.getInitialContext().forEach((path, value) -> {
            if (parse(path, "Invalid initial context path").isRoot() || value == null) {
                throw new OrchestrationSetupException("Initial context entries need a path and a value: " + path,
                        Map.of("path", String.valueOf(path)));
            }
            seed.put(path, value);
        });
        graph.getAgents().forEach(agent -> agent.getReadDependencies()
                .forEach(prefix -> parse(prefix, "Invalid context dependency of " + agent.getName())));

        return new RunExecution(runId, graph, maxConcurrency, agentTimeout, runTimeout, maxFailures, seed,
                contextManager.scoped(runId), messageBroker, loop, workers, metrics, structuredLogger);
    }

    private static ContextPath parse(String path, String message) {
        try {
            return ContextPath.of(path);
        } catch (ContextPathException e) {
            throw new OrchestrationSetupException(message + ": " + path, Map.of("path", String.valueOf(path)));
        }
    }

    private Mono<RunExecution> findRun(String runId) {
        return Mono.defer(() -> {
            RunExecution execution = runId != null ? runs.get(runId) : null;
            return execution != null ? Mono.just(execution) : Mono.error(new RunNotFoundException(String.valueOf(runId)));
        });
    }
}
