package com.z254.switchboard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Definition of one unit of work routed to an agent.
 * <p>
 * The definition is immutable and may be reused across workflow runs; runtime status and
 * output are tracked per execution and reported through {@link TaskOutcome}.
 */
@Value
@Builder(toBuilder = true)
public class AgentTask {

    /**
     * Payload key under which the outputs of a task's dependencies are passed to its agent.
     */
    public static final String CONTEXT_KEY = "context";

    /**
     * Identifier of this task within the workflow. Defaults to the agent id.
     */
    String id;

    /**
     * Agent that should handle the task.
     */
    String agentId;

    /**
     * Capability used by capability-based resolution.
     */
    AgentCapability capability;

    /**
     * Free-form intent used by intent-based resolution.
     */
    String intent;

    @Singular("payloadEntry")
    Map<String, Object> payload;

    /**
     * Ids of tasks that must reach a terminal status before this one is eligible.
     */
    @Singular("dependency")
    Set<String> dependsOn;

    /**
     * Evaluated against completed outputs once all dependencies succeeded. Null means always run.
     */
    Predicate<WorkflowContext> condition;

    /**
     * Per-call timeout. Null means the agent or breaker default applies.
     */
    Duration timeout;

    public String getId() {
        return id != null ? id : agentId;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    /**
     * Evaluate the condition, treating a missing condition as always true.
     */
    public boolean shouldRun(WorkflowContext context) {
        return condition == null || condition.test(context);
    }

    public static AgentTask forAgent(String agentId, Map<String, Object> payload) {
        return AgentTask.builder()
                .agentId(agentId)
                .payload(payload != null ? payload : Map.of())
                .build();
    }
}
