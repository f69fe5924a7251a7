package com.z254.switchboard.orchestration.pattern;

import com.z254.switchboard.domain.model.CoordinationStrategy;
import com.z254.switchboard.orchestration.TaskRunner;
import com.z254.switchboard.orchestration.WorkflowRun;
import reactor.core.publisher.Mono;

/**
 * Interface for coordination strategy executors.
 * Each strategy decides when the tasks of a workflow are attempted.
 */
public interface StrategyExecutor {

    /**
     * Get the coordination strategy this executor implements.
     */
    CoordinationStrategy getStrategy();

    /**
     * Drive every task of the run to a terminal status.
     *
     * @param run    the workflow run whose tasks are executed
     * @param runner runs a single eligible task
     * @return completes once every attempted task is terminal; errors only for an invalid workflow
     */
    Mono<Void> execute(WorkflowRun run, TaskRunner runner);

    /**
     * Get the name of this strategy for logging/display.
     */
    default String getName() {
        return getStrategy().name();
    }
}
