package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.SkipReason;
import com.z254.switchboard.domain.model.TaskOutcome;
import com.z254.switchboard.domain.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable execution state of one task within one workflow run.
 * Status only moves forward; once terminal every further transition is ignored.
 */
public class TaskRun {

    private final AgentTask task;

    private TaskStatus status = TaskStatus.PENDING;
    private String agentId;
    private Map<String, Object> output;
    private String error;
    private String errorType;
    private SkipReason skipReason;
    private boolean fallbackUsed;
    private Instant startedAt;
    private Instant completedAt;

    public TaskRun(AgentTask task) {
        this.task = task;
        this.agentId = task.getAgentId();
    }

    public AgentTask getTask() {
        return task;
    }

    public String getId() {
        return task.getId();
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized Map<String, Object> getOutput() {
        return output;
    }

    public synchronized boolean markRunning(Instant at) {
        if (!status.canTransitionTo(TaskStatus.RUNNING)) {
            return false;
        }
        status = TaskStatus.RUNNING;
        startedAt = at;
        return true;
    }

    public synchronized void assignAgent(String resolvedAgentId) {
        this.agentId = resolvedAgentId;
    }

    public synchronized boolean succeed(Map<String, Object> result, boolean fromFallback, Instant at) {
        if (!complete(TaskStatus.SUCCEEDED, at)) {
            return false;
        }
        output = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
        fallbackUsed = fromFallback;
        return true;
    }

    public synchronized boolean fail(Throwable cause, Instant at) {
        if (!complete(TaskStatus.FAILED, at)) {
            return false;
        }
        error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        errorType = cause.getClass().getSimpleName();
        return true;
    }

    public synchronized boolean skip(SkipReason reason, String message, Instant at) {
        if (!complete(TaskStatus.SKIPPED, at)) {
            return false;
        }
        skipReason = reason;
        error = message;
        return true;
    }

    public synchronized TaskOutcome toOutcome() {
        Duration duration = startedAt != null && completedAt != null
                ? Duration.between(startedAt, completedAt)
                : Duration.ZERO;
        return TaskOutcome.builder()
                .taskId(task.getId())
                .agentId(agentId)
                .status(status)
                .output(output)
                .error(error)
                .errorType(errorType)
                .skipReason(skipReason)
                .fallbackUsed(fallbackUsed)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .duration(duration)
                .build();
    }

    private boolean complete(TaskStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        completedAt = at;
        return true;
    }
}
