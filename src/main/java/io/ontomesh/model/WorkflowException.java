package io.ontomesh.model;

/**
 * Domain failure with a message meant for the caller as-is.
 */
public class WorkflowException extends RuntimeException {
    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
