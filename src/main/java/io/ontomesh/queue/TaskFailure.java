package io.ontomesh.queue;

public record TaskFailure(String taskId, String taskName, Exception error) {
    public String message() {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
