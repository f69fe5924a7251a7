package com.z254.switchboard.registry;

import com.z254.switchboard.config.SwitchboardProperties;
import com.z254.switchboard.domain.model.AgentDescriptor;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Registers the agents declared under {@code switchboard.agents} at startup.
 * Agents without an endpoint are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentRegistryInitializer {

    private final AgentRegistry registry;
    private final SwitchboardProperties properties;

    @PostConstruct
    public void registerConfiguredAgents() {
        int registered = 0;
        for (SwitchboardProperties.AgentProperties agent : properties.getAgents()) {
            if (agent.getEndpoint() == null || agent.getEndpoint().isBlank()) {
                log.info("Skipping agent {} - no endpoint configured", agent.getId());
                continue;
            }
            registry.register(toDescriptor(agent));
            registered++;
        }
        log.info("Agent registry initialized with {} agents", registered);
    }

    static AgentDescriptor toDescriptor(SwitchboardProperties.AgentProperties agent) {
        return AgentDescriptor.builder()
                .id(agent.getId())
                .name(agent.getName() != null ? agent.getName() : agent.getId())
                .description(agent.getDescription())
                .endpoint(agent.getEndpoint().trim())
                .capabilities(agent.getCapabilities())
                .priority(agent.getPriority())
                .enabled(agent.isEnabled())
                .timeout(agent.getTimeout())
                .metadata(agent.getMetadata())
                .build();
    }
}
