package com.z254.switchboard.agent;

import com.z254.switchboard.domain.model.AgentDescriptor;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Performs the actual call to a remote conversational agent.
 * <p>
 * Implementations signal {@link TransientAgentException} for timeouts and connection
 * problems and {@link PermanentAgentException} for requests the endpoint rejected.
 * Any other error is treated as a failure as well.
 */
@FunctionalInterface
public interface AgentInvoker {

    /**
     * Invoke the agent described by {@code descriptor}.
     *
     * @param descriptor target agent
     * @param payload    request payload, including dependency outputs under {@code context}
     * @return the agent output
     */
    Mono<Map<String, Object>> invoke(AgentDescriptor descriptor, Map<String, Object> payload);
}
