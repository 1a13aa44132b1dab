package io.ontomesh.model;

import java.util.Map;

public record EntityState(
        String id,
        String workflowId,
        EntityType entityType,
        String entityKey,
        EntityStatus status,
        int retryCount,
        String lastError,
        Map<String, Object> stateData,
        long createdAtMs,
        long updatedAtMs
) {
    public EntityState {
        stateData = stateData == null ? Map.of() : stateData;
    }
}
