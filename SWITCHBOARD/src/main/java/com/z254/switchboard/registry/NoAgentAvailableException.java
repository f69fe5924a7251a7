package com.z254.switchboard.registry;

/**
 * Thrown when routing or resolution finds no enabled agent for a request.
 */
public class NoAgentAvailableException extends RuntimeException {

    public NoAgentAvailableException(String message) {
        super(message);
    }
}
