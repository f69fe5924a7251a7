package com.z254.switchboard.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.WorkflowResult;
import com.z254.switchboard.resilience.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured logging utility for SWITCHBOARD.
 * Provides consistent, machine-parseable log entries with workflow and task context.
 */
@Component
@Slf4j
public class StructuredLogger {

    // MDC keys for context
    public static final String MDC_WORKFLOW_ID = "workflowId";
    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_AGENT_ID = "agentId";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a task.
     */
    public void setTaskContext(String workflowId, String taskId, String agentId) {
        if (workflowId != null) MDC.put(MDC_WORKFLOW_ID, workflowId);
        if (taskId != null) MDC.put(MDC_TASK_ID, taskId);
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
    }

    /**
     * Clear MDC context.
     */
    public void clearContext() {
        MDC.remove(MDC_WORKFLOW_ID);
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_AGENT_ID);
    }

    public void logWorkflowStarted(String workflowId, CoordinationStrategy strategy, int taskCount) {
        MDC.put(MDC_WORKFLOW_ID, workflowId);
        try {
            logEvent("workflow_started", Map.of(
                    "workflowId", workflowId,
                    "strategy", strategy.name(),
                    "taskCount", taskCount
            ));
        } finally {
            MDC.remove(MDC_WORKFLOW_ID);
        }
    }

    public void logWorkflowCompleted(WorkflowResult result) {
        MDC.put(MDC_WORKFLOW_ID, result.getWorkflowId());
        try {
            logEvent("workflow_completed", Map.of(
                    "workflowId", result.getWorkflowId(),
                    "strategy", result.getStrategy().name(),
                    "status", result.getStatus().name(),
                    "durationMs", result.getDuration().toMillis(),
                    "taskCount", result.getTasks().size(),
                    "timedOut", result.isTimedOut()
            ));
        } finally {
            MDC.remove(MDC_WORKFLOW_ID);
        }
    }

    /**
     * Log a task reaching a terminal status.
     */
    public void logTaskOutcome(String workflowId, TaskOutcome outcome) {
        setTaskContext(workflowId, outcome.getTaskId(), outcome.getAgentId());
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("status", outcome.getStatus().name());
            data.put("durationMs", outcome.getDuration().toMillis());
            if (outcome.getSkipReason() != null) data.put("skipReason", outcome.getSkipReason().name());
            if (outcome.getErrorType() != null) data.put("errorType", outcome.getErrorType());
            if (outcome.getError() != null) data.put("error", outcome.getError());
            if (outcome.isFallbackUsed()) data.put("fallbackUsed", true);
            logEvent("task_" + outcome.getStatus().name().toLowerCase(Locale.ROOT), data);
        } finally {
            clearContext();
        }
    }

    public void logBreakerTransition(String breakerName, CircuitState from, CircuitState to) {
        logEvent("circuit_breaker_transition", Map.of(
                "breaker", breakerName,
                "from", from.getValue(),
                "to", to.getValue()
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "switchboard");

        // Add MDC context
        String workflowId = MDC.get(MDC_WORKFLOW_ID);
        if (workflowId != null) event.put(MDC_WORKFLOW_ID, workflowId);

        String taskId = MDC.get(MDC_TASK_ID);
        if (taskId != null) event.put(MDC_TASK_ID, taskId);

        String agentId = MDC.get(MDC_AGENT_ID);
        if (agentId != null) event.put(MDC_AGENT_ID, agentId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
