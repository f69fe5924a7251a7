package com.z254.switchboard.agent;

/**
 * Invalid request or request rejected by the endpoint. Repeating it will not help.
 */
public class PermanentAgentException extends AgentInvocationException {

    public PermanentAgentException(String agentId, String message) {
        super(agentId, message);
    }

    public PermanentAgentException(String agentId, String message, Throwable cause) {
        super(agentId, message, cause);
    }
}
