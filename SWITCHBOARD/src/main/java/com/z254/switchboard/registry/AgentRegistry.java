package com.z254.switchboard.registry;

import com.z254.switchboard.config.SwitchboardProperties;
import com.z254.switchboard.domain.model.AgentCapability;
import com.z254.switchboard.domain.model.AgentDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of agent descriptors.
 * Resolves which agent handles a capability or intent.
 * <p>
 * Lookups take the read lock; registration and enable/disable take the write lock.
 * Descriptors are kept in registration order so equal priorities resolve to the earliest registration.
 */
@Component
@Slf4j
public class AgentRegistry {

    private static final Comparator<AgentDescriptor> BY_PRIORITY =
            Comparator.comparingInt(AgentDescriptor::getPriority);

    private final Map<String, AgentDescriptor> agents = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AgentCapability defaultCapability;

    @Autowired
    public AgentRegistry(SwitchboardProperties properties) {
        this(properties.getRegistry().getDefaultCapability());
    }

    /**
     * @param defaultCapability capability used for intents missing from the lookup table, may be null
     */
    public AgentRegistry(AgentCapability defaultCapability) {
        this.defaultCapability = defaultCapability;
    }

    public AgentRegistry() {
        this((AgentCapability) null);
    }

    /**
     * Register a descriptor, replacing any existing descriptor with the same id.
     * A replaced descriptor keeps its original registration slot.
     */
    public void register(AgentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.getId() == null || descriptor.getId().isBlank()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
        lock.writeLock().lock();
        try {
            AgentDescriptor previous = agents.put(descriptor.getId(), descriptor);
            if (previous != null) {
                log.info("Replaced agent: {} (priority={}, enabled={})",
                        descriptor.getId(), descriptor.getPriority(), descriptor.isEnabled());
            } else {
                log.info("Registered agent: {} with capabilities {}",
                        descriptor.getId(), descriptor.getCapabilities());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AgentDescriptor> get(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if the agent exists
     */
    public boolean enable(String agentId) {
        return setEnabled(agentId, true);
    }

    /**
     * @return true if the agent exists
     */
    public boolean disable(String agentId) {
        return setEnabled(agentId, false);
    }

    /**
     * All descriptors ordered by priority.
     */
    public List<AgentDescriptor> list(boolean enabledOnly) {
        lock.readLock().lock();
        try {
            return agents.values().stream()
                    .filter(agent -> !enabledOnly || agent.isEnabled())
                    .sorted(BY_PRIORITY)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Enabled agents advertising a capability, lowest priority value first.
     * Ties keep registration order.
     */
    public List<AgentDescriptor> findByCapability(AgentCapability capability) {
        lock.readLock().lock();
        try {
            return agents.values().stream()
                    .filter(AgentDescriptor::isEnabled)
                    .filter(agent -> agent.supports(capability))
                    .sorted(BY_PRIORITY)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Preferred enabled agent for a capability.
     *
     * @throws NoAgentAvailableException if no enabled agent advertises the capability
     */
    public AgentDescriptor resolve(AgentCapability capability) {
        List<AgentDescriptor> candidates = findByCapability(capability);
        if (candidates.isEmpty()) {
            log.warn("No agent found for capability: {}", capability);
            throw new NoAgentAvailableException("No enabled agent for capability: "
                    + (capability != null ? capability.getValue() : null));
        }
        return candidates.get(0);
    }

    /**
     * Route a free-form intent to the preferred agent.
     * Unknown intents use the configured default capability when one is set.
     *
     * @throws NoAgentAvailableException if the intent is unknown without a default, or no enabled agent matches
     */
    public AgentDescriptor route(String intent) {
        AgentCapability capability = IntentCatalog.capabilityFor(intent).orElse(defaultCapability);
        if (capability == null) {
            throw new NoAgentAvailableException("Unknown intent: " + intent);
        }
        AgentDescriptor agent = resolve(capability);
        log.debug("Routed intent '{}' to agent {} via {}", intent, agent.getId(), capability);
        return agent;
    }

    public RegistryStats stats() {
        lock.readLock().lock();
        try {
            int enabled = 0;
            Map<AgentCapability, Integer> byCapability = new EnumMap<>(AgentCapability.class);
            for (AgentDescriptor agent : agents.values()) {
                if (!agent.isEnabled()) {
                    continue;
                }
                enabled++;
                for (AgentCapability capability : agent.getCapabilities()) {
                    byCapability.merge(capability, 1, Integer::sum);
                }
            }
            return new RegistryStats(agents.size(), enabled, Map.copyOf(byCapability));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean setEnabled(String agentId, boolean enabled) {
        lock.writeLock().lock();
        try {
            AgentDescriptor current = agents.get(agentId);
            if (current == null) {
                log.warn("Cannot {} unknown agent: {}", enabled ? "enable" : "disable", agentId);
                return false;
            }
            if (current.isEnabled() != enabled) {
                agents.put(agentId, current.withEnabled(enabled));
                log.info("Agent {} {}", agentId, enabled ? "enabled" : "disabled");
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
