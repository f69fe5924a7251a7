package com.z254.switchboard.agent;

import com.z254.switchboard.domain.model.AgentDescriptor;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Produces an alternate result when an agent's circuit breaker is open.
 */
@FunctionalInterface
public interface FallbackProvider {

    Mono<Map<String, Object>> fallback(AgentDescriptor descriptor, Map<String, Object> payload);
}
