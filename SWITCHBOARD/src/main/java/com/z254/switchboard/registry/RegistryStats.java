package com.z254.switchboard.registry;

import com.z254.switchboard.domain.model.AgentCapability;

import java.util.Map;

/**
 * Read-only registry snapshot.
 *
 * @param total        registered agents
 * @param enabled      enabled agents
 * @param byCapability number of enabled agents advertising each capability
 */
public record RegistryStats(int total, int enabled, Map<AgentCapability, Integer> byCapability) {

    public int enabledFor(AgentCapability capability) {
        return byCapability.getOrDefault(capability, 0);
    }
}
