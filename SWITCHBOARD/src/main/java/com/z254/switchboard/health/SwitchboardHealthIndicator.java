package com.z254.switchboard.health;

import com.z254.switchboard.registry.AgentRegistry;
import com.z254.switchboard.registry.RegistryStats;
import com.z254.switchboard.resilience.CircuitBreakerRegistry;
import com.z254.switchboard.resilience.CircuitBreakerSnapshot;
import com.z254.switchboard.resilience.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for SWITCHBOARD.
 * Reports registry counts and circuit breaker states.
 */
@Component
@Slf4j
public class SwitchboardHealthIndicator implements ReactiveHealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "At least one circuit breaker is open");

    private final AgentRegistry agentRegistry;
    private final CircuitBreakerRegistry breakerRegistry;

    public SwitchboardHealthIndicator(AgentRegistry agentRegistry, CircuitBreakerRegistry breakerRegistry) {
        this.agentRegistry = agentRegistry;
        this.breakerRegistry = breakerRegistry;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::buildHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Health buildHealth() {
        RegistryStats stats = agentRegistry.stats();
        Map<String, CircuitBreakerSnapshot> snapshots = breakerRegistry.snapshots();

        Map<String, String> breakerStates = new LinkedHashMap<>();
        long open = 0;
        for (CircuitBreakerSnapshot snapshot : snapshots.values()) {
            breakerStates.put(snapshot.name(), snapshot.state().getValue());
            if (snapshot.state() == CircuitState.OPEN) {
                open++;
            }
        }

        Health.Builder builder;
        if (stats.enabled() == 0) {
            builder = Health.down();
        } else if (open > 0) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }

        return builder
                .withDetail("totalAgents", stats.total())
                .withDetail("enabledAgents", stats.enabled())
                .withDetail("openCircuits", open)
                .withDetail("circuitBreakers", breakerStates)
                .build();
    }
}
