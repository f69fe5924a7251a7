package com.z254.switchboard.resilience;

import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-endpoint circuit breaker.
 * <p>
 * Tracks consecutive failures while CLOSED and opens once {@code failureThreshold} is reached.
 * While OPEN every call is rejected with {@link CircuitOpenException} (or routed to the caller's
 * fallback) without touching the endpoint. The first call after {@code recoveryTimeout} moves the
 * breaker to HALF_OPEN, where a bounded number of trial calls pass through: any failure reopens it,
 * {@code successThreshold} consecutive successes close it. Counters reset on every transition.
 * <p>
 * All state lives behind a single lock so the breaker can be shared by concurrently running tasks.
 * Outcomes of calls admitted before the most recent transition only update the totals.
 */
@Slf4j
public class CircuitBreaker {

    private static final int RECENT_FAILURES_REPORTED = 10;

    private final String name;
    private final BreakerConfig config;
    private final Clock clock;
    private final TimeLimiter defaultTimeLimiter;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private int failureCount;
    private int successCount;
    private int halfOpenInFlight;
    private Instant openedAt;
    private Instant lastFailureAt;
    private long totalRequests;
    private long totalSuccesses;
    private long totalFailures;
    private long totalTimeouts;
    private long totalRejections;
    private final Deque<CircuitBreakerSnapshot.FailureRecord> recentFailures = new ArrayDeque<>();

    public CircuitBreaker(String name, BreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config.validate();
        this.clock = clock;
        this.defaultTimeLimiter = timeLimiter(config.getRequestTimeout());
        log.info("Circuit breaker initialized: name={}, failureThreshold={}, recoveryTimeout={}",
                name, config.getFailureThreshold(), config.getRecoveryTimeout());
    }

    public CircuitBreaker(String name, BreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public String getName() {
        return name;
    }

    public BreakerConfig getConfig() {
        return config;
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Call through the breaker with the default request timeout and no fallback.
     */
    public <T> Mono<T> call(Supplier<? extends Mono<? extends T>> action) {
        return call(action, null, null);
    }

    /**
     * Call through the breaker with the given timeout and no fallback.
     */
    public <T> Mono<T> call(Supplier<? extends Mono<? extends T>> action, Duration timeout) {
        return call(action, timeout, null);
    }

    /**
     * Call through the breaker.
     *
     * @param action   produces the endpoint call; only invoked when the breaker admits the call
     * @param timeout  per-call timeout, null for the configured request timeout
     * @param fallback produces the result when the breaker rejects the call, may be null
     * @return the call result; errors with {@link CircuitOpenException} when rejected without a
     *         fallback, or {@link CallTimeoutException} when the call exceeds its timeout
     */
    public <T> Mono<T> call(Supplier<? extends Mono<? extends T>> action,
                            Duration timeout,
                            Supplier<? extends Mono<? extends T>> fallback) {
        return Mono.defer(() -> {
            Permit permit = acquirePermit();
            if (permit == null) {
                if (fallback != null) {
                    log.debug("Circuit breaker '{}' open, using fallback", name);
                    return Mono.<T>defer(fallback);
                }
                return Mono.error(new CircuitOpenException(name, remainingOpenTime()));
            }

            Duration effectiveTimeout = effectiveTimeout(timeout);
            TimeLimiter limiter = effectiveTimeout.equals(config.getRequestTimeout())
                    ? defaultTimeLimiter
                    : timeLimiter(effectiveTimeout);

            return Mono.<T>defer(action)
                    .transformDeferred(TimeLimiterOperator.of(limiter))
                    .onErrorMap(TimeoutException.class,
                            e -> new CallTimeoutException(name, effectiveTimeout, e))
                    .doOnSuccess(value -> onSuccess(permit))
                    .doOnError(error -> onFailure(permit, error))
                    .doOnCancel(() -> onCancel(permit));
        });
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent snapshot of state, counters and recent failures.
     */
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            List<CircuitBreakerSnapshot.FailureRecord> failures = new ArrayList<>(recentFailures);
            int from = Math.max(0, failures.size() - RECENT_FAILURES_REPORTED);
            return new CircuitBreakerSnapshot(
                    name,
                    state,
                    failureCount,
                    successCount,
                    openedAt,
                    lastFailureAt,
                    totalRequests,
                    totalSuccesses,
                    totalFailures,
                    totalTimeouts,
                    totalRejections,
                    List.copyOf(failures.subList(from, failures.size())),
                    config);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force the breaker back to CLOSED with all counters reset.
     */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = transitionTo(CircuitState.CLOSED);
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker '{}' manually reset", name);
        publish(transition);
    }

    private Permit acquirePermit() {
        Transition transition = null;
        Permit permit;
        lock.lock();
        try {
            totalRequests++;
            if (state == CircuitState.OPEN) {
                if (recoveryTimeoutElapsed()) {
                    transition = transitionTo(CircuitState.HALF_OPEN);
                } else {
                    totalRejections++;
                    log.warn("Request rejected - circuit '{}' is OPEN", name);
                    return null;
                }
            }
            if (state == CircuitState.HALF_OPEN) {
                if (halfOpenInFlight >= config.getEffectivePermittedCallsInHalfOpen()) {
                    totalRejections++;
                    log.warn("Request rejected - circuit '{}' has no half-open trial slots", name);
                    permit = null;
                } else {
                    halfOpenInFlight++;
                    log.debug("Request allowed in half-open state: {}", name);
                    permit = new Permit(CircuitState.HALF_OPEN, generation);
                }
            } else {
                permit = new Permit(CircuitState.CLOSED, generation);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
        return permit;
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        lock.lock();
        try {
            totalSuccesses++;
            releaseTrialSlot(permit);
            if (permit.generation() != generation) {
                return;
            }
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.getSuccessThreshold()) {
                    transition = transitionTo(CircuitState.CLOSED);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private void onFailure(Permit permit, Throwable error) {
        Transition transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            totalFailures++;
            if (error instanceof CallTimeoutException) {
                totalTimeouts++;
            }
            lastFailureAt = now;
            recordFailure(now, error);
            releaseTrialSlot(permit);
            if (permit.generation() != generation) {
                return;
            }
            if (state == CircuitState.HALF_OPEN) {
                transition = transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED) {
                failureCount++;
                log.warn("Circuit breaker failure recorded: name={}, failureCount={}, error={}",
                        name, failureCount, error.getMessage());
                if (failureCount >= config.getFailureThreshold()) {
                    transition = transitionTo(CircuitState.OPEN);
                }
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private void onCancel(Permit permit) {
        lock.lock();
        try {
            releaseTrialSlot(permit);
        } finally {
            lock.unlock();
        }
    }

    private void releaseTrialSlot(Permit permit) {
        if (permit.admittedIn() == CircuitState.HALF_OPEN
                && permit.generation() == generation
                && halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    private void recordFailure(Instant at, Throwable error) {
        recentFailures.addLast(new CircuitBreakerSnapshot.FailureRecord(
                at, String.valueOf(error.getMessage()), error.getClass().getSimpleName()));
        while (recentFailures.size() > config.getRecentFailureCapacity()) {
            recentFailures.removeFirst();
        }
    }

    private Transition transitionTo(CircuitState target) {
        CircuitState previous = state;
        state = target;
        generation++;
        failureCount = 0;
        successCount = 0;
        halfOpenInFlight = 0;
        if (target == CircuitState.OPEN) {
            openedAt = clock.instant();
        } else if (target == CircuitState.CLOSED) {
            openedAt = null;
        }

        switch (target) {
            case OPEN -> log.warn("Circuit breaker '{}' opened (was {}), totalFailures={}",
                    name, previous, totalFailures);
            case HALF_OPEN -> log.info("Circuit breaker '{}' transitioning to half-open", name);
            case CLOSED -> log.info("Circuit breaker '{}' closed (was {})", name, previous);
        }
        return new Transition(previous, target);
    }

    private boolean recoveryTimeoutElapsed() {
        if (openedAt == null) {
            return false;
        }
        Duration elapsed = Duration.between(openedAt, clock.instant());
        return elapsed.compareTo(config.getRecoveryTimeout()) >= 0;
    }

    private Duration remainingOpenTime() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN || openedAt == null) {
                return Duration.ZERO;
            }
            Duration remaining = config.getRecoveryTimeout()
                    .minus(Duration.between(openedAt, clock.instant()));
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    private Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.getRequestTimeout();
        }
        return requested;
    }

    private TimeLimiter timeLimiter(Duration timeout) {
        return TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    private void publish(Transition transition) {
        if (transition == null || transition.from() == transition.to()) {
            return;
        }
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateTransition(name, transition.from(), transition.to());
            } catch (RuntimeException e) {
                log.warn("Circuit state listener failed for '{}': {}", name, e.getMessage());
            }
        }
    }

    private record Permit(CircuitState admittedIn, long generation) {
    }

    private record Transition(CircuitState from, CircuitState to) {
    }
}
