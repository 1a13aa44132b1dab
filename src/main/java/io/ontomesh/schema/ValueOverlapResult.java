package io.ontomesh.schema;

/**
 * Sampled overlap between two columns: how many distinct sampled source values exist in the target.
 */
public record ValueOverlapResult(long sourceDistinct, long targetDistinct, long matchedCount, double matchRate) {
    public static ValueOverlapResult of(long sourceDistinct, long targetDistinct, long matchedCount) {
        double rate = sourceDistinct <= 0L ? 0.0d : (double) matchedCount / (double) sourceDistinct;
        return new ValueOverlapResult(sourceDistinct, targetDistinct, matchedCount, rate);
    }
}
