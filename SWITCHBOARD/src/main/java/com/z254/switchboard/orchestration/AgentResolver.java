package com.z254.switchboard.orchestration;

import com.z254.switchboard.domain.model.AgentDescriptor;
import com.z254.switchboard.domain.model.AgentTask;
import com.z254.switchboard.registry.AgentRegistry;
import com.z254.switchboard.registry.NoAgentAvailableException;

/**
 * Resolves the agent that should handle a task.
 */
@FunctionalInterface
public interface AgentResolver {

    /**
     * @throws NoAgentAvailableException if no enabled agent can handle the task
     */
    AgentDescriptor resolve(AgentTask task, AgentRegistry registry);

    /**
     * Use the task's agent id. The agent must be registered and enabled.
     */
    static AgentResolver byAgentId() {
        return (task, registry) -> registry.get(task.getAgentId())
                .filter(AgentDescriptor::isEnabled)
                .orElseThrow(() -> new NoAgentAvailableException(
                        "No enabled agent with id: " + task.getAgentId()));
    }

    /**
     * Use the preferred agent for the task's capability.
     */
    static AgentResolver byCapability() {
        return (task, registry) -> {
            if (task.getCapability() == null) {
                throw new NoAgentAvailableException("Task " + task.getId() + " has no capability");
            }
            return registry.resolve(task.getCapability());
        };
    }

    /**
     * Route the task's intent through the registry's intent table.
     */
    static AgentResolver byIntent() {
        return (task, registry) -> {
            if (task.getIntent() == null) {
                throw new NoAgentAvailableException("Task " + task.getId() + " has no intent");
            }
            return registry.route(task.getIntent());
        };
    }
}
