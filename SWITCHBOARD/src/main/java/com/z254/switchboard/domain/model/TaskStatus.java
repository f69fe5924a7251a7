package com.z254.switchboard.domain.model;

/**
 * Lifecycle status of a task within one workflow execution.
 * Status only moves forward: PENDING, optionally RUNNING, then one terminal status.
 */
public enum TaskStatus {

    /**
     * Task has not started yet.
     */
    PENDING,

    /**
     * Task is currently invoking its agent.
     */
    RUNNING,

    /**
     * Agent invocation (or its fallback) produced an output.
     */
    SUCCEEDED,

    /**
     * Agent invocation failed, or the task could not be dispatched.
     */
    FAILED,

    /**
     * Task was not executed (unmet dependency, false condition, not selected, or deadline).
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check whether moving from this status to {@code next} goes forward.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
