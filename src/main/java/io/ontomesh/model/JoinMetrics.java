package io.ontomesh.model;

public record JoinMetrics(
        String cardinality,
        double joinMatchRate,
        double orphanRate,
        double targetCoverage,
        long sourceRowCount,
        long targetRowCount,
        long matchedRows,
        long orphanRows
) {
}
