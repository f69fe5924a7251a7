package com.z254.switchboard.orchestration;

/**
 * A workflow definition that cannot be executed. Raised before any task runs.
 */
public class WorkflowValidationException extends RuntimeException {

    public WorkflowValidationException(String message) {
        super(message);
    }

    public WorkflowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
