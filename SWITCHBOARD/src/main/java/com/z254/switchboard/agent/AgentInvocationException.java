package com.z254.switchboard.agent;

import lombok.Getter;

/**
 * Base class for failures reported by an {@link AgentInvoker}.
 */
@Getter
public class AgentInvocationException extends RuntimeException {

    private final String agentId;

    public AgentInvocationException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public AgentInvocationException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    /**
     * Whether retrying the same request later could succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
