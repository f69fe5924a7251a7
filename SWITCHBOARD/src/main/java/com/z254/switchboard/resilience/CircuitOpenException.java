package com.z254.switchboard.resilience;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised immediately, without invoking the endpoint, when a breaker rejects a call.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitOpenException(String breakerName, Duration retryAfter) {
        super("Circuit breaker '" + breakerName + "' is OPEN");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }
}
