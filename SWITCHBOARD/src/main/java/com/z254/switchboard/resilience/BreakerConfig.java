package com.z254.switchboard.resilience;

import com.z254.switchboard.config.SwitchboardProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds and timeouts of a single circuit breaker.
 */
@Value
@Builder(toBuilder = true)
public class BreakerConfig {

    /**
     * Consecutive failures in CLOSED that open the circuit.
     */
    @Builder.Default
    int failureThreshold = 5;

    /**
     * Time spent OPEN before the next call is admitted as a half-open trial.
     */
    @Builder.Default
    Duration recoveryTimeout = Duration.ofSeconds(60);

    /**
     * Consecutive half-open successes that close the circuit.
     */
    @Builder.Default
    int successThreshold = 2;

    /**
     * Timeout applied to a call that does not specify one.
     */
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Maximum concurrent trial calls while HALF_OPEN. Zero means {@link #successThreshold}.
     */
    @Builder.Default
    int permittedCallsInHalfOpen = 0;

    /**
     * Number of failure records retained for monitoring.
     */
    @Builder.Default
    int recentFailureCapacity = 100;

    public static BreakerConfig defaults() {
        return BreakerConfig.builder().build();
    }

    public static BreakerConfig from(SwitchboardProperties.BreakerSettings settings) {
        return BreakerConfig.builder()
                .failureThreshold(settings.getFailureThreshold())
                .recoveryTimeout(settings.getRecoveryTimeout())
                .successThreshold(settings.getSuccessThreshold())
                .requestTimeout(settings.getRequestTimeout())
                .permittedCallsInHalfOpen(settings.getPermittedCallsInHalfOpen())
                .recentFailureCapacity(settings.getRecentFailureCapacity())
                .build()
                .validate();
    }

    public int getEffectivePermittedCallsInHalfOpen() {
        return permittedCallsInHalfOpen > 0 ? permittedCallsInHalfOpen : successThreshold;
    }

    /**
     * Reject nonsensical thresholds.
     *
     * @return this config
     * @throws IllegalArgumentException if a threshold or timeout is out of range
     */
    public BreakerConfig validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be at least 1");
        }
        if (permittedCallsInHalfOpen < 0) {
            throw new IllegalArgumentException("permittedCallsInHalfOpen must not be negative");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        return this;
    }
}
