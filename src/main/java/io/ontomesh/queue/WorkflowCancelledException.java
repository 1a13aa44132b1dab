package io.ontomesh.queue;

import io.ontomesh.model.WorkflowException;

public final class WorkflowCancelledException extends WorkflowException {
    public WorkflowCancelledException(String reason) {
        super("workflow cancelled: " + reason);
    }
}
