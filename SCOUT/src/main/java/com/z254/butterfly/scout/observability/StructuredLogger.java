package com.z254.butterfly.scout.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for SCOUT.
 * Provides consistent, machine-parseable log entries with run and agent context.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_AGENT_NAME = "agentName";
    public static final String MDC_CORRELATION_ID = "correlationId";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for an agent task.
     */
    public void setAgentContext(String runId, String agentName, String correlationId) {
        if (runId != null) MDC.put(MDC_RUN_ID, runId);
        if (agentName != null) MDC.put(MDC_AGENT_NAME, agentName);
        if (correlationId != null) MDC.put(MDC_CORRELATION_ID, correlationId);
    }

    /**
     * Clear MDC context.
     */
    public void clearContext() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_AGENT_NAME);
        MDC.remove(MDC_CORRELATION_ID);
    }

    public void logRunStarted(String runId, int agentCount, int maxConcurrency) {
        logEvent("run_started", Map.of(
                "runId", runId,
                "agentCount", agentCount,
                "maxConcurrency", maxConcurrency
        ));
    }

    /**
     * Log an agent state change.
     */
    public void logAgentTransition(String runId, String agentName, String from, String to, String detail) {
        Map<String, Object> data = new HashMap<>();
        data.put("runId", runId);
        data.put("agentName", agentName);
        data.put("from", from);
        data.put("to", to);
        if (detail != null) {
            data.put("detail", detail);
        }
        logEvent("agent_transition", data);
    }

    public void logRunCompleted(String runId, String status, long durationMs,
                                int succeeded, int failed, int skipped, String cancellationReason) {
        Map<String, Object> data = new HashMap<>();
        data.put("runId", runId);
        data.put("status", status);
        data.put("durationMs", durationMs);
        data.put("succeeded", succeeded);
        data.put("failed", failed);
        data.put("skipped", skipped);
        if (cancellationReason != null) {
            data.put("cancellationReason", cancellationReason);
        }
        logEvent("run_completed", data);
    }

    /**
     * Log a point-to-point message that found no subscriber. Only emitted at debug level.
     */
    public void logMessageDropped(String messageId, String topic, String recipient) {
        if (log.isDebugEnabled()) {
            logEvent("message_dropped", Map.of(
                    "messageId", messageId,
                    "topic", topic != null ? topic : "",
                    "recipient", recipient
            ));
        }
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "scout");

        // Add MDC context
        String correlationId = MDC.get(MDC_CORRELATION_ID);
        if (correlationId != null) event.put("correlationId", correlationId);

        String agentName = MDC.get(MDC_AGENT_NAME);
        if (agentName != null) event.putIfAbsent("agentName", agentName);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
