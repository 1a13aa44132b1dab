package io.ontomesh.schema;

/**
 * Inner-join counts: {@code sourceMatched} and {@code targetMatched} count distinct column
 * values taking part in the join, {@code orphanCount} counts source rows with no match.
 */
public record JoinAnalysis(long joinCount, long sourceMatched, long targetMatched, long orphanCount) {
}
