package io.ontomesh.task;

import io.ontomesh.model.JoinMetrics;
import io.ontomesh.schema.JoinAnalysis;

/**
 * Turns raw test-join counts into rates and a cardinality label.
 */
public final class JoinMetricsCalculator {
    static final double CARDINALITY_TOLERANCE = 0.05d;

    private JoinMetricsCalculator() {
    }

    /**
     * Row counts below one are treated as one so rates stay finite.
     */
    public static JoinMetrics compute(JoinAnalysis join, long sourceRows, long targetRows) {
        long srcRows = Math.max(1L, sourceRows);
        long tgtRows = Math.max(1L, targetRows);
        long orphans = join.orphanCount();
        long matched = srcRows - orphans;
        double joinMatchRate = (double) matched / (double) srcRows;
        double orphanRate = (double) orphans / (double) srcRows;
        double targetCoverage = (double) join.targetMatched() / (double) tgtRows;
        return new JoinMetrics(cardinality(join), joinMatchRate, orphanRate, targetCoverage,
                srcRows, tgtRows, matched, orphans);
    }

    public static String cardinality(JoinAnalysis join) {
        if (join.joinCount() == 0L || join.sourceMatched() == 0L) {
            return "N:1";
        }
        double limit = 1.0d + CARDINALITY_TOLERANCE;
        double avgTargetsPerSource = (double) join.joinCount() / (double) join.sourceMatched();
        double avgSourcesPerTarget = join.targetMatched() == 0L
                ? 0.0d
                : (double) join.joinCount() / (double) join.targetMatched();
        boolean manyTargets = avgTargetsPerSource > limit;
        boolean manySources = avgSourcesPerTarget > limit;
        if (manyTargets && manySources) {
            return join.targetMatched() <= join.sourceMatched() ? "N:1" : "N:M";
        }
        if (manySources) {
            return "N:1";
        }
        if (manyTargets) {
            return "1:N";
        }
        return "1:1";
    }
}
