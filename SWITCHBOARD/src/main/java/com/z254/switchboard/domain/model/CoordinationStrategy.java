package com.z254.switchboard.domain.model;

/**
 * Execution discipline applied to a task set.
 */
public enum CoordinationStrategy {

    /**
     * One task at a time in input order.
     */
    SEQUENTIAL,

    /**
     * Every eligible task starts as soon as its dependencies are terminal.
     */
    PARALLEL,

    /**
     * A router picks exactly one task, the others are skipped.
     */
    CONDITIONAL
}
