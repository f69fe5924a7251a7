package com.z254.switchboard.resilience;

/**
 * Circuit breaker states.
 *
 * <pre>
 * CLOSED --(failure threshold reached)--> OPEN
 * OPEN --(recovery timeout elapsed, next call)--> HALF_OPEN
 * HALF_OPEN --(success threshold reached)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 */
public enum CircuitState {

    /**
     * Normal operation, calls pass through.
     */
    CLOSED("closed"),

    /**
     * Endpoint considered unhealthy, calls are rejected without invoking it.
     */
    OPEN("open"),

    /**
     * Probing recovery, a limited number of trial calls pass through.
     */
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
