package io.ontomesh.queue;

public record TaskSnapshot(
        String id,
        String name,
        String status,
        boolean llm,
        int attempts,
        String error,
        long enqueuedAtMs,
        long startedAtMs,
        long finishedAtMs
) {
}
