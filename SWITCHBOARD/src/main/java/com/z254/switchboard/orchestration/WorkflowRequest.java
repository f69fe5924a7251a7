package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.domain.model.CoordinationStrategy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * A set of tasks to execute together under one strategy.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowRequest {

    /**
     * Identifier used in logs and history. Generated when null.
     */
    String workflowId;

    @Singular
    List<AgentTask> tasks;

    @Builder.Default
    CoordinationStrategy strategy = CoordinationStrategy.SEQUENTIAL;

    /**
     * Required for {@link CoordinationStrategy#CONDITIONAL}.
     */
    TaskRouter router;

    @Builder.Default
    AgentResolver resolver = AgentResolver.byAgentId();

    /**
     * Workflow deadline. Null falls back to the configured default, which may itself be unset.
     */
    Duration deadline;

    public static WorkflowRequest of(List<AgentTask> tasks, CoordinationStrategy strategy) {
        return WorkflowRequest.builder()
                .tasks(tasks)
                .strategy(strategy)
                .build();
    }
}
