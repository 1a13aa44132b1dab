package io.ontomesh.model;

public record RelationshipCandidate(
        String id,
        String workflowId,
        String datasourceId,
        String sourceColumnId,
        String targetColumnId,
        DetectionMethod detectionMethod,
        double confidence,
        Double valueMatchRate,
        String cardinality,
        Double joinMatchRate,
        Double orphanRate,
        Double targetCoverage,
        Long sourceRowCount,
        Long targetRowCount,
        Long matchedRows,
        Long orphanRows,
        String description,
        boolean required,
        CandidateStatus status,
        String userDecision,
        long createdAtMs,
        long updatedAtMs
) {
    public static RelationshipCandidate detected(
            String id,
            String workflowId,
            String datasourceId,
            String sourceColumnId,
            String targetColumnId,
            DetectionMethod method,
            double confidence,
            Double valueMatchRate,
            long nowMs
    ) {
        return new RelationshipCandidate(id, workflowId, datasourceId, sourceColumnId, targetColumnId,
                method, confidence, valueMatchRate, null, null, null, null, null, null, null, null,
                null, false, CandidateStatus.PENDING, null, nowMs, nowMs);
    }

    public RelationshipCandidate withJoinMetrics(JoinMetrics metrics) {
        return new RelationshipCandidate(id, workflowId, datasourceId, sourceColumnId, targetColumnId,
                detectionMethod, confidence, valueMatchRate, metrics.cardinality(), metrics.joinMatchRate(),
                metrics.orphanRate(), metrics.targetCoverage(), metrics.sourceRowCount(), metrics.targetRowCount(),
                metrics.matchedRows(), metrics.orphanRows(), description, required, status, userDecision,
                createdAtMs, updatedAtMs);
    }

    public RelationshipCandidate withReview(
            DetectionMethod method,
            double newConfidence,
            String reasoning,
            CandidateStatus newStatus,
            boolean isRequired
    ) {
        return new RelationshipCandidate(id, workflowId, datasourceId, sourceColumnId, targetColumnId,
                method, newConfidence, valueMatchRate, cardinality, joinMatchRate, orphanRate, targetCoverage,
                sourceRowCount, targetRowCount, matchedRows, orphanRows, reasoning, isRequired, newStatus,
                userDecision, createdAtMs, updatedAtMs);
    }

    public boolean acceptedByUser() {
        return CandidateStatus.ACCEPTED.wire().equals(userDecision);
    }
}
