package com.z254.switchboard.agent;

/**
 * Timeout, connection failure or server-side error. The endpoint may recover.
 */
public class TransientAgentException extends AgentInvocationException {

    public TransientAgentException(String agentId, String message) {
        super(agentId, message);
    }

    public TransientAgentException(String agentId, String message, Throwable cause) {
        super(agentId, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
