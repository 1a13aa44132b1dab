package io.ontomesh.model;

public record SchemaRelationship(
        String id,
        String datasourceId,
        String sourceColumnId,
        String targetColumnId,
        String relationshipType,
        String cardinality,
        String inferenceMethod,
        double confidence,
        String description,
        Double matchRate,
        Long matchedCount
) {
}
