package com.z254.switchboard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Describes a remote conversational agent endpoint.
 * Descriptors are immutable; enabling or disabling an agent replaces its descriptor in the registry.
 */
@Value
@Builder(toBuilder = true)
public class AgentDescriptor {

    /**
     * Unique identifier of the agent.
     */
    String id;

    /**
     * Human readable name.
     */
    String name;

    String description;

    /**
     * Opaque endpoint handle passed to the agent invoker.
     */
    String endpoint;

    /**
     * Capabilities this agent can serve.
     */
    @Singular
    Set<AgentCapability> capabilities;

    /**
     * Routing priority, lower is preferred.
     */
    int priority;

    @Builder.Default
    boolean enabled = true;

    /**
     * Per-call timeout for this agent. Null means the breaker default applies.
     */
    Duration timeout;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public boolean supports(AgentCapability capability) {
        return capability != null && capabilities.contains(capability);
    }

    public AgentDescriptor withEnabled(boolean enabled) {
        return toBuilder().enabled(enabled).build();
    }
}
