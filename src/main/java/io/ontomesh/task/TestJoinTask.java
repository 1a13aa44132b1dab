package io.ontomesh.task;

import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.JoinMetrics;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.schema.ColumnRef;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.JoinAnalysis;
import io.ontomesh.schema.SchemaDiscoverer;
import io.ontomesh.schema.SchemaRepository;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.EntityStateStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the candidate's join against the datasource and stores the measured metrics on the
 * candidate. The test-join entity moves {@code pending -> scanning -> complete}.
 */
public final class TestJoinTask extends EntityTask {
    private final CandidateStore candidates;
    private final SchemaRepository schema;
    private final DiscovererFactory discoverers;
    private final String candidateId;

    public TestJoinTask(
            EntityStateStore states,
            CandidateStore candidates,
            SchemaRepository schema,
            DiscovererFactory discoverers,
            String stateId,
            String candidateId,
            int maxRetries
    ) {
        super(states, stateId, maxRetries);
        this.candidates = candidates;
        this.schema = schema;
        this.discoverers = discoverers;
        this.candidateId = candidateId;
    }

    @Override
    public String name() {
        return "test-join:" + candidateId;
    }

    @Override
    protected void run(RunContext context) throws Exception {
        states.updateStatus(stateId, EntityStatus.SCANNING, null);
        RelationshipCandidate candidate = candidates.get(candidateId)
                .orElseThrow(() -> new IllegalStateException("candidate not found: " + candidateId));
        SchemaColumn sourceColumn = column(candidate.sourceColumnId());
        SchemaColumn targetColumn = column(candidate.targetColumnId());
        SchemaTable sourceTable = table(sourceColumn.tableId());
        SchemaTable targetTable = table(targetColumn.tableId());

        JoinAnalysis join;
        try (SchemaDiscoverer discoverer = discoverers.open(candidate.datasourceId())) {
            join = discoverer.analyzeJoin(
                    new ColumnRef(sourceTable.schemaName(), sourceTable.tableName(), sourceColumn.columnName()),
                    new ColumnRef(targetTable.schemaName(), targetTable.tableName(), targetColumn.columnName()));
        }
        context.throwIfCancelled();
        JoinMetrics metrics = JoinMetricsCalculator.compute(join, rows(sourceTable), rows(targetTable));
        candidates.update(candidate.withJoinMetrics(metrics));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cardinality", metrics.cardinality());
        data.put("join_match_rate", metrics.joinMatchRate());
        data.put("orphan_rate", metrics.orphanRate());
        data.put("target_coverage", metrics.targetCoverage());
        states.updateStateData(stateId, EntityStatus.COMPLETE, data);
    }

    private SchemaColumn column(String columnId) {
        return schema.getColumn(columnId)
                .orElseThrow(() -> new IllegalStateException("column not found in schema: " + columnId));
    }

    private SchemaTable table(String tableId) {
        return schema.getTable(tableId)
                .orElseThrow(() -> new IllegalStateException("table not found in schema: " + tableId));
    }

    private static long rows(SchemaTable table) {
        return table.rowCount() == null ? 1L : table.rowCount();
    }
}
