package com.z254.switchboard.domain.model;

/**
 * Why a task ended in {@link TaskStatus#SKIPPED}.
 */
public enum SkipReason {

    /**
     * A dependency failed or was skipped.
     */
    DEPENDENCY_NOT_SATISFIED,

    /**
     * The task's condition evaluated to false.
     */
    CONDITION_NOT_MET,

    /**
     * A conditional router selected another task.
     */
    NOT_SELECTED,

    /**
     * The workflow deadline elapsed before the task finished.
     */
    WORKFLOW_TIMEOUT
}
