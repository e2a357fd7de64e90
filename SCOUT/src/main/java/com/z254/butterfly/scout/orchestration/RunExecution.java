package com.z254.butterfly.scout.orchestration;

import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.*;
import com.z254.butterfly.scout.exception.AgentExecutionException;
import com.z254.butterfly.scout.exception.AgentTimeoutException;
import com.z254.butterfly.scout.exception.ScoutException;
import com.z254.butterfly.scout.messaging.AgentMessage;
import com.z254.butterfly.scout.messaging.MessageBroker;
import com.z254.butterfly.scout.observability.ScoutMetrics;
import com.z254.butterfly.scout.observability.StructuredLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * State machine of one run.
 * <p>
 * Every state transition runs on the orchestrator's single-threaded loop scheduler; agent
 * tasks run on the worker pool and report back to the loop. Fields without a concurrent
 * type are only touched from the loop.
 */
@Slf4j
class RunExecution implements AgentRun {

    static final String ORCHESTRATOR = "orchestrator";
    static final String STATUS_PATH = "analysis_status";

    static final String STATUS_IN_PROGRESS = "in_progress";
    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_FAILED = "failed";

    private final String runId;
    private final DependencyGraph graph;
    private final int maxConcurrency;
    private final Duration agentTimeout;
    private final Duration runTimeout;
    private final int maxFailures;
    private final Map<String, Object> initialContext;
    private final SharedContextManager context;
    private final MessageBroker broker;
    private final Scheduler loop;
    private final Scheduler workers;
    private final ScoutMetrics metrics;
    private final StructuredLogger structuredLogger;

    private final Map<String, RunState> states = new ConcurrentHashMap<>();
    private final Map<String, AgentOutcome> outcomes = new ConcurrentHashMap<>();
    private final Deque<String> readyQueue = new ArrayDeque<>();
    private final Map<String, Disposable> inFlight = new HashMap<>();
    private final Map<String, Timer.Sample> timers = new HashMap<>();
    private final Disposable.Composite resources = Disposables.composite();
    private final Sinks.Many<LifecycleEvent> lifecycleSink = Sinks.many().replay().all();
    private final Sinks.One<RunResult> resultSink = Sinks.one();

    private int running;
    private int failures;
    private String cancellationReason;
    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile RunResult finalResult;
    private volatile Instant startedAt;

    RunExecution(String runId,
                 DependencyGraph graph,
                 int maxConcurrency,
                 Duration agentTimeout,
                 Duration runTimeout,
                 int maxFailures,
                 Map<String, Object> initialContext,
                 SharedContextManager context,
                 MessageBroker broker,
                 Scheduler loop,
                 Scheduler workers,
                 ScoutMetrics metrics,
                 StructuredLogger structuredLogger) {
        this.runId = runId;
        this.graph = graph;
        this.maxConcurrency = maxConcurrency;
        this.agentTimeout = agentTimeout;
        this.runTimeout = runTimeout;
        this.maxFailures = maxFailures;
        this.initialContext = initialContext;
        this.context = context;
        this.broker = broker;
        this.loop = loop;
        this.workers = workers;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        graph.getNames().forEach(name -> states.put(name, RunState.PENDING));
    }

    // --------------------------------------------------------------------------------------------
    // AgentRun
    // --------------------------------------------------------------------------------------------

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public Mono<RunResult> result() {
        return resultSink.asMono();
    }

    @Override
    public Flux<LifecycleEvent> lifecycle() {
        return lifecycleSink.asFlux();
    }

    RunStatus getStatus() {
        return status;
    }

    boolean isFinished() {
        return status != RunStatus.RUNNING;
    }

    RunSnapshot snapshot() {
        Map<String, RunState> ordered = new LinkedHashMap<>();
        graph.getNames().forEach(name -> ordered.put(name, states.get(name)));
        return RunSnapshot.builder()
                .runId(runId)
                .status(status)
                .agentStates(ordered)
                .startedAt(startedAt)
                .result(finalResult)
                .build();
    }

    // --------------------------------------------------------------------------------------------
    // Loop entry points
    // --------------------------------------------------------------------------------------------

    void start() {
        loop.schedule(this::doStart);
    }

    /**
     * @return completes with true if the run was still running
     */
    Mono<Boolean> cancel(String reason) {
        return Mono.create(sink -> loop.schedule(() -> sink.success(doCancel(reason))));
    }

    private void doStart() {
        startedAt = Instant.now();
        metrics.recordRunStarted();
        structuredLogger.logRunStarted(runId, graph.size(), maxConcurrency);

        initialContext.forEach((path, value) -> context.set(path, value, ORCHESTRATOR));

        // Context dependencies are re-checked whenever something is written under them
        Set<String> prefixes = new LinkedHashSet<>();
        graph.getAgents().forEach(agent -> prefixes.addAll(agent.getReadDependencies()));
        for (String prefix : prefixes) {
            resources.add(context.watch(prefix)
                    .subscribe(entry -> loop.schedule(this::evaluate),
                            error -> log.warn("Watch on {} for run {} failed: {}", prefix, runId, error.getMessage())));
        }

        if (runTimeout != null && !runTimeout.isZero() && !runTimeout.isNegative()) {
            resources.add(loop.schedule(() -> doCancel("run timed out"),
                    runTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        log.info("Started run {} with {} agents (max concurrency {})", runId, graph.size(), maxConcurrency);
        evaluate();
    }

    // --------------------------------------------------------------------------------------------
    // Scheduling
    // --------------------------------------------------------------------------------------------

    private void evaluate() {
        if (isFinished()) {
            return;
        }
        boolean progressed = true;
        while (progressed) {
            progressed = promotePending();
            dispatchReady();
            if (!progressed && running == 0 && readyQueue.isEmpty()) {
                progressed = skipStalled();
            }
        }
        if (allTerminal()) {
            finish();
        }
    }

    /**
     * Move Pending agents to Ready or Skipped where their predecessors and context allow.
     */
    private boolean promotePending() {
        boolean changed = false;
        for (String name : graph.getTopologicalOrder()) {
            if (states.get(name) != RunState.PENDING) {
                continue;
            }
            AgentDescriptor agent = graph.getAgent(name);
            String blockingPredecessor = null;
            boolean waiting = false;
            for (String predecessor : agent.getPredecessors()) {
                RunState predecessorState = states.get(predecessor);
                if (!predecessorState.isTerminal()) {
                    waiting = true;
                } else if (predecessorState != RunState.SUCCEEDED && !agent.toleratesFailureOf(predecessor)) {
                    blockingPredecessor = predecessor;
                    break;
                }
            }
            if (blockingPredecessor != null) {
                transition(name, RunState.SKIPPED,
                        "predecessor " + blockingPredecessor + " " + states.get(blockingPredecessor));
                changed = true;
            } else if (!waiting && firstUnsatisfiedDependency(agent) == null) {
                transition(name, RunState.READY, null);
                readyQueue.add(name);
                changed = true;
            }
        }
        return changed;
    }

    private void dispatchReady() {
        while (running < maxConcurrency && !readyQueue.isEmpty()) {
            launch(readyQueue.poll());
        }
    }

    /**
     * Nothing is running or ready, so no agent of this run can write the missing context.
     * Skip the earliest Pending agents whose predecessors are all terminal.
     */
    private boolean skipStalled() {
        boolean changed = false;
        for (String name : graph.getTopologicalOrder()) {
            if (states.get(name) != RunState.PENDING) {
                continue;
            }
            AgentDescriptor agent = graph.getAgent(name);
            boolean predecessorsTerminal = agent.getPredecessors().stream()
                    .allMatch(p -> states.get(p).isTerminal());
            if (predecessorsTerminal) {
                String missing = firstUnsatisfiedDependency(agent);
                transition(name, RunState.SKIPPED, "context dependency " + missing + " never satisfied");
                changed = true;
            }
        }
        return changed;
    }

    private String firstUnsatisfiedDependency(AgentDescriptor agent) {
        return agent.getReadDependencies().stream()
                .filter(prefix -> !context.hasAny(prefix))
                .findFirst()
                .orElse(null);
    }

    private boolean allTerminal() {
        return states.values().stream().allMatch(RunState::isTerminal);
    }

    // --------------------------------------------------------------------------------------------
    // Task execution
    // --------------------------------------------------------------------------------------------

    private void launch(String name) {
        AgentDescriptor agent = graph.getAgent(name);
        Duration timeout = agent.getTimeout() != null ? agent.getTimeout() : agentTimeout;

        running++;
        transition(name, RunState.RUNNING, null);
        timers.put(name, metrics.startAgentTimer());

        Mono<TaskResult> task = Mono.fromCallable(() -> invoke(agent))
                .subscribeOn(workers);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            task = task.timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new AgentTimeoutException(name, timeout));
        }

        Disposable disposable = task.subscribe(
                result -> loop.schedule(() -> complete(name, result, null)),
                error -> loop.schedule(() -> complete(name, null, error)),
                () -> loop.schedule(() -> complete(name, null, null)));
        inFlight.put(name, disposable);
    }

    private TaskResult invoke(AgentDescriptor agent) throws Exception {
        structuredLogger.setAgentContext(runId, agent.getName(), null);
        try {
            return agent.getTask().runTask(agent.getName(), context, broker);
        } finally {
            structuredLogger.clearContext();
        }
    }

    private void complete(String name, TaskResult result, Throwable error) {
        if (states.get(name) != RunState.RUNNING) {
            // cancelled or aborted while the task was in flight
            return;
        }
        inFlight.remove(name);
        running--;
        metrics.recordAgentFinished(timers.remove(name));

        if (error == null && result != null && result.isSuccess()) {
            outcome(name).setData(result.getData());
            transition(name, RunState.SUCCEEDED, null);
        } else {
            String message = failureMessage(name, result, error);
            failures++;
            log.warn("Agent {} failed in run {}: {}", name, runId, message);
            transition(name, RunState.FAILED, message);
            if (maxFailures > 0 && failures >= maxFailures) {
                abort("failure threshold reached (" + failures + " failed agents)");
                return;
            }
        }
        evaluate();
    }

    private String failureMessage(String name, TaskResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof AgentExecutionException ? error
                    : new AgentExecutionException(name, describe(error), error);
            return cause.getMessage();
        }
        if (result == null) {
            return "Agent " + name + " returned no result";
        }
        return result.getError() != null ? result.getError() : "Agent " + name + " reported failure";
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // --------------------------------------------------------------------------------------------
    // Cancellation and completion
    // --------------------------------------------------------------------------------------------

    private boolean doCancel(String reason) {
        if (isFinished()) {
            return false;
        }
        cancellationReason = reason;
        log.info("Cancelling run {}: {}", runId, reason);
        skipRemaining("cancelled: " + reason);
        finish();
        return true;
    }

    private void abort(String reason) {
        log.warn("Aborting run {}: {}", runId, reason);
        skipRemaining(reason);
        finish();
    }

    private void skipRemaining(String reason) {
        for (String name : graph.getTopologicalOrder()) {
            RunState state = states.get(name);
            if (state.isTerminal()) {
                continue;
            }
            if (state == RunState.RUNNING) {
                Disposable disposable = inFlight.remove(name);
                if (disposable != null) {
                    disposable.dispose();
                }
                running--;
                metrics.recordAgentFinished(timers.remove(name));
            }
            transition(name, RunState.SKIPPED, reason);
        }
        readyQueue.clear();
    }

    private void finish() {
        if (isFinished()) {
            return;
        }
        resources.dispose();

        boolean requiredSucceeded = graph.getAgents().stream()
                .filter(agent -> !agent.isOptional())
                .allMatch(agent -> states.get(agent.getName()) == RunState.SUCCEEDED);
        RunStatus finalStatus = cancellationReason == null && requiredSucceeded
                ? RunStatus.SUCCEEDED
                : RunStatus.FAILED;

        Map<String, AgentOutcome> ordered = new LinkedHashMap<>();
        graph.getNames().forEach(name -> ordered.put(name, outcome(name)));
        RunResult result = RunResult.builder()
                .runId(runId)
                .status(finalStatus)
                .outcomes(ordered)
                .cancellationReason(cancellationReason)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .context(context.getSubtree(""))
                .build();

        finalResult = result;
        status = finalStatus;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", runId);
        payload.put("status", finalStatus.name());
        payload.put("succeeded", result.getSucceeded());
        payload.put("failed", result.getFailed());
        payload.put("skipped", result.getSkipped());
        if (cancellationReason != null) {
            payload.put("cancellationReason", cancellationReason);
        }
        broadcast("run/" + runId + "/status", payload);

        metrics.recordRunCompleted(finalStatus);
        structuredLogger.logRunCompleted(runId, finalStatus.name(),
                result.getDuration() != null ? result.getDuration().toMillis() : 0,
                result.getSucceeded().size(), result.getFailed().size(), result.getSkipped().size(),
                cancellationReason);
        log.info("Run {} finished: {} (succeeded={}, failed={}, skipped={})", runId, finalStatus,
                result.getSucceeded(), result.getFailed(), result.getSkipped());

        lifecycleSink.tryEmitComplete();
        resultSink.tryEmitValue(result);
    }

    // --------------------------------------------------------------------------------------------
    // Transitions
    // --------------------------------------------------------------------------------------------

    private void transition(String name, RunState to, String detail) {
        RunState from = states.put(name, to);
        AgentOutcome outcome = outcome(name);
        outcome.setState(to);
        Instant now = Instant.now();

        switch (to) {
            case RUNNING -> {
                outcome.setStartedAt(now);
                writeStatus(name, STATUS_IN_PROGRESS);
            }
            case SUCCEEDED -> {
                outcome.setCompletedAt(now);
                writeStatus(name, STATUS_COMPLETED);
            }
            case FAILED -> {
                outcome.setCompletedAt(now);
                outcome.setError(detail);
                writeStatus(name, STATUS_FAILED);
            }
            case SKIPPED -> {
                outcome.setCompletedAt(now);
                outcome.setError(detail);
            }
            default -> {
            }
        }

        lifecycleSink.tryEmitNext(LifecycleEvent.transition(runId, name, from, to, detail));
        structuredLogger.logAgentTransition(runId, name, from != null ? from.name() : null, to.name(), detail);

        if (to.isTerminal()) {
            metrics.recordAgentTerminal(to);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("runId", runId);
            payload.put("agent", name);
            payload.put("state", to.name());
            if (detail != null) {
                payload.put("error", detail);
            }
            broadcast("agent/" + name + "/status", payload);
        }
    }

    private AgentOutcome outcome(String name) {
        return outcomes.computeIfAbsent(name, n -> AgentOutcome.builder()
                .agentName(n)
                .state(RunState.PENDING)
                .optional(graph.getAgent(n).isOptional())
                .build());
    }

    /**
     * Observational status for external consumers; scheduling never reads it back.
     */
    private void writeStatus(String name, String value) {
        try {
            context.set(STATUS_PATH + "/" + name, value, ORCHESTRATOR);
        } catch (ScoutException e) {
            log.warn("Could not write status of {} in run {}: {}", name, runId, e.getMessage());
        }
    }

    private void broadcast(String topic, Map<String, Object> payload) {
        try {
            broker.publish(AgentMessage.lifecycle(topic, ORCHESTRATOR, payload));
        } catch (ScoutException e) {
            log.warn("Could not publish {} for run {}: {}", topic, runId, e.getMessage());
        }
    }
}
