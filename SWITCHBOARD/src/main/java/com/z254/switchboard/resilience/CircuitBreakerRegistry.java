package com.z254.switchboard.resilience;

import com.z254.switchboard.config.SwitchboardProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Holds one circuit breaker per agent endpoint.
 * Breakers are created on first use from the configured defaults and per-name overrides.
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Function<String, BreakerConfig> configResolver;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Counter rejectionCounter;
    private final Counter transitionCounter;

    @Autowired
    public CircuitBreakerRegistry(SwitchboardProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this(name -> BreakerConfig.from(properties.getCircuitBreaker().settingsFor(name)), meterRegistry, clock);
    }

    public CircuitBreakerRegistry(Function<String, BreakerConfig> configResolver,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.configResolver = configResolver;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.rejectionCounter = Counter.builder("switchboard.circuit-breaker.rejections")
                .description("Calls rejected without reaching the endpoint")
                .register(meterRegistry);
        this.transitionCounter = Counter.builder("switchboard.circuit-breaker.transitions")
                .register(meterRegistry);
    }

    /**
     * Get the breaker for a name, creating it on first use.
     * Concurrent callers for the same name always receive the same instance.
     */
    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, this::create);
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> all() {
        return List.copyOf(breakers.values());
    }

    /**
     * Snapshots of every breaker created so far, keyed by name.
     */
    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    public boolean anyOpen() {
        return breakers.values().stream().anyMatch(b -> b.getState() == CircuitState.OPEN);
    }

    /**
     * Attach a listener to every existing breaker and to breakers created later.
     */
    public void addListener(CircuitStateListener listener) {
        listeners.add(listener);
        breakers.values().forEach(breaker -> breaker.addListener(listener));
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("Reset {} circuit breakers", breakers.size());
    }

    private CircuitBreaker create(String name) {
        CircuitBreaker breaker = new CircuitBreaker(name, configResolver.apply(name), clock);
        breaker.addListener((breakerName, from, to) -> {
            transitionCounter.increment();
            log.info("Circuit breaker state change: name={}, {} -> {}", breakerName, from, to);
        });
        listeners.forEach(breaker::addListener);

        Gauge.builder("switchboard.circuit-breaker.state", breaker, b -> stateValue(b.getState()))
                .tag("name", name)
                .description("0=closed, 1=half_open, 2=open")
                .register(meterRegistry);
        Gauge.builder("switchboard.circuit-breaker.rejected", breaker, b -> b.snapshot().totalRejections())
                .tag("name", name)
                .register(meterRegistry);
        return breaker;
    }

    /**
     * Count a rejection observed by a caller.
     */
    public void recordRejection() {
        rejectionCounter.increment();
    }

    private static double stateValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
