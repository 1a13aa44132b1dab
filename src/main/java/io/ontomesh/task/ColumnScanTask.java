package io.ontomesh.task;

import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.schema.ColumnRef;
import io.ontomesh.schema.ColumnStats;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.SchemaDiscoverer;
import io.ontomesh.schema.ValueOverlapResult;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.EntityStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Samples one column and, when it looks like a foreign key, scores the guess with a
 * value-overlap check and records a candidate. The column moves {@code pending -> scanning -> complete}.
 */
public final class ColumnScanTask extends EntityTask {
    private static final Logger log = LoggerFactory.getLogger(ColumnScanTask.class);

    private final CandidateStore candidates;
    private final DiscovererFactory discoverers;
    private final ForeignKeyHeuristics heuristics;
    private final String workflowId;
    private final String datasourceId;
    private final SchemaTable table;
    private final SchemaColumn column;
    private final int sampleLimit;
    private final int overlapSampleSize;

    public ColumnScanTask(
            EntityStateStore states,
            CandidateStore candidates,
            DiscovererFactory discoverers,
            ForeignKeyHeuristics heuristics,
            String workflowId,
            String datasourceId,
            String stateId,
            SchemaTable table,
            SchemaColumn column,
            int sampleLimit,
            int overlapSampleSize,
            int maxRetries
    ) {
        super(states, stateId, maxRetries);
        this.candidates = candidates;
        this.discoverers = discoverers;
        this.heuristics = heuristics;
        this.workflowId = workflowId;
        this.datasourceId = datasourceId;
        this.table = table;
        this.column = column;
        this.sampleLimit = sampleLimit;
        this.overlapSampleSize = overlapSampleSize;
    }

    @Override
    public String name() {
        return "column-scan:" + table.tableName() + "." + column.columnName();
    }

    @Override
    protected void run(RunContext context) throws Exception {
        states.updateStatus(stateId, EntityStatus.SCANNING, null);
        try (SchemaDiscoverer discoverer = discoverers.open(datasourceId)) {
            List<ColumnStats> stats = discoverer.analyzeColumnStats(table.schemaName(), table.tableName(),
                    List.of(column.columnName()));
            if (!stats.isEmpty()) {
                Map<String, Object> gathered = ColumnSampler.gather(discoverer, table.schemaName(), table.tableName(),
                        stats.get(0), sampleLimit);
                states.updateStateData(stateId, EntityStatus.SCANNING, gathered);
            }
            context.throwIfCancelled();

            Optional<ForeignKeyHeuristics.Match> match = heuristics.detect(table, column);
            if (match.isPresent()) {
                recordCandidate(discoverer, match.get());
            }
        }
        states.updateStatus(stateId, EntityStatus.COMPLETE, null);
    }

    private void recordCandidate(SchemaDiscoverer discoverer, ForeignKeyHeuristics.Match match) throws Exception {
        SchemaColumn target = match.targetColumn();
        if (candidates.exists(workflowId, column.id(), target.id())) {
            return;
        }
        ColumnRef source = new ColumnRef(table.schemaName(), table.tableName(), column.columnName());
        ColumnRef targetRef = new ColumnRef(match.targetTable().schemaName(), match.targetTable().tableName(),
                target.columnName());
        ValueOverlapResult overlap = discoverer.analyzeValueOverlap(source, targetRef, overlapSampleSize);
        double confidence = blend(match.confidence(), overlap.matchRate());
        DetectionMethod method = match.fromMetadata() ? DetectionMethod.METADATA : DetectionMethod.NAME_INFERENCE;
        RelationshipCandidate candidate = RelationshipCandidate.detected(UUID.randomUUID().toString(), workflowId,
                datasourceId, column.id(), target.id(), method, confidence, overlap.matchRate(),
                Instant.now().toEpochMilli());
        if (candidates.create(candidate)) {
            log.info("Detected {} candidate {} -> {} (confidence {})", method.wire(), source, targetRef,
                    String.format(Locale.ROOT, "%.2f", confidence));
        }
    }

    /**
     * Mean of the heuristic prior and the observed overlap, rounded to two places.
     */
    static double blend(double base, double matchRate) {
        double value = (base + matchRate) / 2.0d;
        return Math.round(value * 100.0d) / 100.0d;
    }
}
