package com.z254.switchboard.resilience;

/**
 * Notified after a breaker changes state. Called outside the breaker lock.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateTransition(String breakerName, CircuitState from, CircuitState to);
}
