package com.z254.switchboard.domain.model;

/**
 * Aggregated outcome of a workflow execution.
 */
public enum WorkflowStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
