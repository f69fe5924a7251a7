package com.z254.switchboard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated, immutable result of one workflow execution.
 */
@Value
@Builder
public class WorkflowResult {

    String workflowId;

    CoordinationStrategy strategy;

    WorkflowStatus status;

    /**
     * Per-task outcomes keyed by task id, in input order.
     */
    Map<String, TaskOutcome> tasks;

    Instant startedAt;

    Instant completedAt;

    /**
     * Total wall-clock duration of the workflow.
     */
    Duration duration;

    /**
     * True when the workflow deadline elapsed before every task finished.
     */
    boolean timedOut;

    public Optional<TaskOutcome> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public TaskStatus statusOf(String taskId) {
        TaskOutcome outcome = tasks.get(taskId);
        if (outcome == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return outcome.getStatus();
    }

    public List<TaskOutcome> tasksWithStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(outcome -> outcome.getStatus() == status)
                .toList();
    }

    public long count(TaskStatus status) {
        return tasks.values().stream()
                .filter(outcome -> outcome.getStatus() == status)
                .count();
    }
}
