package io.ontomesh.task;

import io.ontomesh.model.JoinMetrics;
import io.ontomesh.schema.JoinAnalysis;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class JoinMetricsCalculatorTest {

    @Test
    void manyOrdersPerCustomerIsManyToOne() {
        // 100 orders over 20 customers, 10 orders point nowhere
        JoinAnalysis join = new JoinAnalysis(90L, 20L, 20L, 10L);
        JoinMetrics m = JoinMetricsCalculator.compute(join, 100L, 25L);
        Assertions.assertEquals("N:1", m.cardinality());
        Assertions.assertEquals(0.9d, m.joinMatchRate(), 1e-9);
        Assertions.assertEquals(0.1d, m.orphanRate(), 1e-9);
        Assertions.assertEquals(0.8d, m.targetCoverage(), 1e-9);
        Assertions.assertEquals(90L, m.matchedRows());
        Assertions.assertEquals(10L, m.orphanRows());
    }

    @Test
    void cardinalityLabels() {
        Assertions.assertEquals("1:1", JoinMetricsCalculator.cardinality(new JoinAnalysis(50L, 50L, 50L, 0L)));
        Assertions.assertEquals("1:N", JoinMetricsCalculator.cardinality(new JoinAnalysis(200L, 50L, 200L, 0L)));
        Assertions.assertEquals("N:M", JoinMetricsCalculator.cardinality(new JoinAnalysis(400L, 50L, 80L, 0L)));
        Assertions.assertEquals("N:1", JoinMetricsCalculator.cardinality(new JoinAnalysis(0L, 0L, 0L, 10L)));
    }

    @Test
    void emptyTablesKeepRatesFinite() {
        JoinMetrics m = JoinMetricsCalculator.compute(new JoinAnalysis(0L, 0L, 0L, 0L), 0L, 0L);
        Assertions.assertEquals(1L, m.sourceRowCount());
        Assertions.assertEquals(1L, m.targetRowCount());
        Assertions.assertTrue(Double.isFinite(m.joinMatchRate()));
        Assertions.assertEquals(0.0d, m.targetCoverage(), 1e-9);
    }
}
