package io.ontomesh.model;

public final class LeaseLostException extends WorkflowException {
    public LeaseLostException(String workflowId) {
        super("workflow not found or not owned by this server: " + workflowId);
    }
}
