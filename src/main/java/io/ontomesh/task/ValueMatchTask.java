package io.ontomesh.task;

import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.RelationshipCandidate;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkTask;
import io.ontomesh.storage.CandidateStore;
import io.ontomesh.storage.EntityStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Pairwise comparison of the sampled values of every scanned column. A source column whose
 * samples mostly appear in another table's column becomes a value-match candidate.
 */
public final class ValueMatchTask implements WorkTask {
    private static final Logger log = LoggerFactory.getLogger(ValueMatchTask.class);

    static final double MATCH_THRESHOLD = 0.30d;
    static final long MIN_DISTINCT_FOR_FK = 3L;
    private static final Set<String> EXCLUDED_TYPES = Set.of(
            "timestamp", "timestamptz", "date", "time", "timetz", "interval", "datetime",
            "timestamp without time zone", "timestamp with time zone",
            "time without time zone", "time with time zone",
            "boolean", "bool",
            "bytea", "blob", "binary",
            "json", "jsonb", "xml",
            "point", "line", "polygon", "geometry"
    );

    private final EntityStateStore states;
    private final CandidateStore candidates;
    private final String workflowId;
    private final String datasourceId;
    private final List<SchemaTable> tables;
    private final List<SchemaColumn> columns;

    public ValueMatchTask(
            EntityStateStore states,
            CandidateStore candidates,
            String workflowId,
            String datasourceId,
            List<SchemaTable> tables,
            List<SchemaColumn> columns
    ) {
        this.states = states;
        this.candidates = candidates;
        this.workflowId = workflowId;
        this.datasourceId = datasourceId;
        this.tables = tables;
        this.columns = columns;
    }

    @Override
    public String id() {
        return "value-match:" + workflowId;
    }

    @Override
    public String name() {
        return "value-match";
    }

    @Override
    public void execute(RunContext context) {
        List<Sampled> joinable = joinableColumns();
        int created = 0;
        for (Sampled source : joinable) {
            if (source.column.primaryKey()) {
                continue;
            }
            context.throwIfCancelled();
            for (Sampled target : joinable) {
                if (target.column.tableId().equals(source.column.tableId())) {
                    continue;
                }
                double rate = matchRate(source.values, target.values);
                if (rate < MATCH_THRESHOLD) {
                    continue;
                }
                if (candidates.exists(workflowId, source.column.id(), target.column.id())) {
                    continue;
                }
                RelationshipCandidate candidate = RelationshipCandidate.detected(UUID.randomUUID().toString(),
                        workflowId, datasourceId, source.column.id(), target.column.id(), DetectionMethod.VALUE_MATCH,
                        rate, rate, Instant.now().toEpochMilli());
                if (candidates.create(candidate)) {
                    created++;
                }
            }
        }
        log.info("Value matching over {} columns created {} candidates for workflow {}", joinable.size(), created, workflowId);
    }

    private List<Sampled> joinableColumns() {
        Map<String, String> tableNames = new HashMap<>();
        for (SchemaTable t : tables) {
            tableNames.put(t.id(), t.tableName());
        }
        Map<String, EntityState> completed = new HashMap<>();
        for (EntityState s : states.listByWorkflow(workflowId)) {
            if (s.entityType() == EntityType.COLUMN && s.status() == EntityStatus.COMPLETE) {
                completed.put(s.entityKey(), s);
            }
        }
        List<Sampled> out = new ArrayList<>();
        for (SchemaColumn c : columns) {
            String tableName = tableNames.get(c.tableId());
            if (tableName == null) {
                continue;
            }
            EntityState state = completed.get(EntityType.columnKey(tableName, c.columnName()));
            if (state == null || !isJoinableType(c.dataType())) {
                continue;
            }
            if (!c.primaryKey() && ColumnSampler.longValue(state.stateData(), ColumnSampler.DISTINCT_COUNT) < MIN_DISTINCT_FOR_FK) {
                continue;
            }
            List<String> samples = ColumnSampler.samples(state.stateData());
            if (samples.isEmpty()) {
                continue;
            }
            out.add(new Sampled(c, new HashSet<>(samples)));
        }
        return out;
    }

    static boolean isJoinableType(String dataType) {
        return !EXCLUDED_TYPES.contains(normalizeType(dataType));
    }

    static String normalizeType(String dataType) {
        if (dataType == null) {
            return "";
        }
        String type = dataType.toLowerCase(Locale.ROOT).trim();
        int paren = type.indexOf('(');
        if (paren >= 0) {
            int close = type.indexOf(')', paren);
            type = close >= 0 ? type.substring(0, paren) + type.substring(close + 1) : type.substring(0, paren);
        }
        return type.trim().replaceAll("\\s+", " ");
    }

    /**
     * Share of source samples present in the target samples.
     */
    static double matchRate(Set<String> source, Set<String> target) {
        if (source.isEmpty()) {
            return 0.0d;
        }
        int matched = 0;
        for (String v : source) {
            if (target.contains(v)) {
                matched++;
            }
        }
        return (double) matched / (double) source.size();
    }

    private static final class Sampled {
        private final SchemaColumn column;
        private final Set<String> values;

        private Sampled(SchemaColumn column, Set<String> values) {
            this.column = column;
            this.values = values;
        }
    }
}
