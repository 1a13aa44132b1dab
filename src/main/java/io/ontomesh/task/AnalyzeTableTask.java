package io.ontomesh.task;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.storage.EntityStateStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the analyzer to name and describe one scanned table. The table moves
 * {@code scanned -> analyzing -> complete}, or parks in {@code needs-input} when the
 * analyzer has open questions.
 */
public final class AnalyzeTableTask extends EntityTask {
    public static final String ANALYSIS = "analysis";
    public static final String QUESTIONS = "questions";

    private final EntityAnalyzer analyzer;
    private final String workflowId;
    private final SchemaTable table;
    private final List<SchemaColumn> columns;

    public AnalyzeTableTask(
            EntityStateStore states,
            EntityAnalyzer analyzer,
            String workflowId,
            String stateId,
            SchemaTable table,
            List<SchemaColumn> columns,
            int maxRetries
    ) {
        super(states, stateId, maxRetries);
        this.analyzer = analyzer;
        this.workflowId = workflowId;
        this.table = table;
        this.columns = columns;
    }

    @Override
    public String name() {
        return "analyze-table:" + table.tableName();
    }

    @Override
    public boolean requiresLlm() {
        return true;
    }

    @Override
    protected void run(RunContext context) throws Exception {
        states.updateStatus(stateId, EntityStatus.ANALYZING, null);
        List<EntityAnalyzer.ColumnProfile> profiles = new ArrayList<>(columns.size());
        for (SchemaColumn c : columns) {
            Optional<EntityState> column = states.getByEntity(workflowId, EntityType.COLUMN,
                    EntityType.columnKey(table.tableName(), c.columnName()));
            Map<String, Object> gathered = column.map(EntityState::stateData).orElse(Map.of());
            profiles.add(new EntityAnalyzer.ColumnProfile(c.columnName(), c.dataType(), c.primaryKey(), gathered));
        }
        EntityAnalyzer.TableAnalysis analysis = analyzer.analyzeTable(
                new EntityAnalyzer.TableProfile(table.tableName(), table.rowCount(), profiles));
        context.throwIfCancelled();

        Map<String, Object> data = new LinkedHashMap<>(current().stateData());
        data.put(ANALYSIS, analysisMap(analysis));
        if (analysis.requiresInput()) {
            data.put(QUESTIONS, analysis.questions());
            states.updateStateData(stateId, EntityStatus.NEEDS_INPUT, data);
            return;
        }
        TableEntities.completeColumns(states, workflowId, table.tableName(), columns);
        states.updateStateData(stateId, EntityStatus.COMPLETE, data);
    }

    @Override
    protected void onFailure(String message) {
        TableEntities.failColumns(states, workflowId, table.tableName(), columns, message);
    }

    static Map<String, Object> analysisMap(EntityAnalyzer.TableAnalysis analysis) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("business_name", analysis.businessName());
        out.put("description", analysis.description());
        out.put("entity_role", analysis.entityRole());
        return out;
    }

    private EntityState current() {
        return states.getByEntity(workflowId, EntityType.TABLE, EntityType.tableKey(table.tableName()))
                .orElseThrow(() -> new IllegalStateException("table entity missing: " + table.tableName()));
    }
}
