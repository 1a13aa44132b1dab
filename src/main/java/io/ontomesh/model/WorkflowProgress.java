package io.ontomesh.model;

public record WorkflowProgress(
        String currentPhase,
        int current,
        int total,
        String message
) {
    public static WorkflowProgress empty(WorkflowPhase phase) {
        return new WorkflowProgress(phase.wire(), 0, 0, "");
    }

    public int percentage() {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100L, (current * 100L) / total);
    }
}
