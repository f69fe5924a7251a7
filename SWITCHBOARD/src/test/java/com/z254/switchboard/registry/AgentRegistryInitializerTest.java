package com.z254.switchboard.registry;

import com.z254.switchboard.config.SwitchboardProperties;
import com.z254.switchboard.domain.model.AgentCapability;
import com.z254.switchboard.domain.model.AgentDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AgentRegistryInitializer}.
 */
class AgentRegistryInitializerTest {

    private static SwitchboardProperties.AgentProperties agent(String id, String endpoint, int priority) {
        SwitchboardProperties.AgentProperties agent = new SwitchboardProperties.AgentProperties();
        agent.setId(id);
        agent.setEndpoint(endpoint);
        agent.setPriority(priority);
        agent.setCapabilities(Set.of(AgentCapability.TICKET_INQUIRY));
        return agent;
    }

    @Test
    @DisplayName("should register configured agents and skip those without an endpoint")
    void registersConfiguredAgents() {
        SwitchboardProperties properties = new SwitchboardProperties();
        properties.getAgents().add(agent("ticketing", " http://ticketing:8080/invoke ", 1));
        properties.getAgents().add(agent("sales", "", 2));
        properties.getAgents().add(agent("finance", null, 3));
        AgentRegistry registry = new AgentRegistry();

        new AgentRegistryInitializer(registry, properties).registerConfiguredAgents();

        assertThat(registry.size()).isEqualTo(1);
        AgentDescriptor ticketing = registry.get("ticketing").orElseThrow();
        assertThat(ticketing.getEndpoint()).isEqualTo("http://ticketing:8080/invoke");
        assertThat(ticketing.getName()).isEqualTo("ticketing");
        assertThat(ticketing.getTimeout()).isNull();
        assertThat(registry.resolve(AgentCapability.TICKET_INQUIRY).getId()).isEqualTo("ticketing");
    }

    @Test
    @DisplayName("should carry the enabled flag into the descriptor")
    void disabledAgent() {
        SwitchboardProperties.AgentProperties hr = agent("hr", "http://hr", 4);
        hr.setEnabled(false);

        AgentDescriptor descriptor = AgentRegistryInitializer.toDescriptor(hr);

        assertThat(descriptor.isEnabled()).isFalse();
        assertThat(descriptor.getPriority()).isEqualTo(4);
    }

    @Test
    @DisplayName("should carry an explicit per-agent timeout")
    void explicitTimeout() {
        SwitchboardProperties.AgentProperties finance = agent("finance", "http://finance", 3);
        finance.setTimeout(Duration.ofSeconds(5));

        assertThat(AgentRegistryInitializer.toDescriptor(finance).getTimeout()).isEqualTo(Duration.ofSeconds(5));
    }
}
