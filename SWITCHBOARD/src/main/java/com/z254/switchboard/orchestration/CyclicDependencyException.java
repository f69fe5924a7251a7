package com.z254.switchboard.orchestration;

import lombok.Getter;

import java.util.List;

/**
 * The dependency relation of a workflow contains a cycle.
 */
@Getter
public class CyclicDependencyException extends WorkflowValidationException {

    /**
     * Task ids along the cycle, with the first id repeated at the end.
     */
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic task dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
