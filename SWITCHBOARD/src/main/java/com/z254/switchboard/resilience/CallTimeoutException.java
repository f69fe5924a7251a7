package com.z254.switchboard.resilience;

import lombok.Getter;

import java.time.Duration;

/**
 * A call admitted by a breaker did not complete within its timeout.
 * Counts as a failure for the breaker.
 */
@Getter
public class CallTimeoutException extends RuntimeException {

    private final String breakerName;
    private final Duration timeout;

    public CallTimeoutException(String breakerName, Duration timeout, Throwable cause) {
        super("Call through '" + breakerName + "' exceeded timeout of " + timeout.toMillis() + "ms", cause);
        this.breakerName = breakerName;
        this.timeout = timeout;
    }
}
