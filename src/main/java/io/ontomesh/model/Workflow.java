package io.ontomesh.model;

public record Workflow(
        String id,
        String projectId,
        String datasourceId,
        WorkflowPhase phase,
        WorkflowState state,
        WorkflowProgress progress,
        String ownerId,
        long lastHeartbeatMs,
        String errorMessage,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean hasDatasource() {
        return datasourceId != null && !datasourceId.isBlank();
    }
}
