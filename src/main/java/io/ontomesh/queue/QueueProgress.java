package io.ontomesh.queue;

public record QueueProgress(
        int total,
        int pending,
        int running,
        int completed,
        int failed,
        int cancelled,
        int paused
) {
    public boolean idle() {
        return pending == 0 && running == 0 && paused == 0;
    }
}
