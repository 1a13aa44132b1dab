package io.ontomesh.task;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.queue.RunContext;
import io.ontomesh.schema.ColumnStats;
import io.ontomesh.schema.DiscovererFactory;
import io.ontomesh.schema.SchemaDiscoverer;
import io.ontomesh.storage.EntityStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Samples every column of one table and stores the gathered data on the column entities.
 * The table moves {@code pending -> scanning -> scanned}.
 */
public final class ScanTableTask extends EntityTask {
    private static final Logger log = LoggerFactory.getLogger(ScanTableTask.class);

    private final DiscovererFactory discoverers;
    private final String workflowId;
    private final String datasourceId;
    private final SchemaTable table;
    private final List<SchemaColumn> columns;
    private final int sampleLimit;

    public ScanTableTask(
            EntityStateStore states,
            DiscovererFactory discoverers,
            String workflowId,
            String datasourceId,
            String stateId,
            SchemaTable table,
            List<SchemaColumn> columns,
            int sampleLimit,
            int maxRetries
    ) {
        super(states, stateId, maxRetries);
        this.discoverers = discoverers;
        this.workflowId = workflowId;
        this.datasourceId = datasourceId;
        this.table = table;
        this.columns = columns;
        this.sampleLimit = sampleLimit;
    }

    @Override
    public String name() {
        return "scan-table:" + table.tableName();
    }

    @Override
    protected void run(RunContext context) throws Exception {
        states.updateStatus(stateId, EntityStatus.SCANNING, null);
        List<String> names = new ArrayList<>(columns.size());
        for (SchemaColumn c : columns) {
            names.add(c.columnName());
        }
        Map<String, Map<String, Object>> gathered = new LinkedHashMap<>();
        try (SchemaDiscoverer discoverer = discoverers.open(datasourceId)) {
            List<ColumnStats> stats = discoverer.analyzeColumnStats(table.schemaName(), table.tableName(), names);
            for (ColumnStats s : stats) {
                context.throwIfCancelled();
                gathered.put(s.columnName(),
                        ColumnSampler.gather(discoverer, table.schemaName(), table.tableName(), s, sampleLimit));
            }
        }
        for (Map.Entry<String, Map<String, Object>> e : gathered.entrySet()) {
            Optional<EntityState> column = states.getByEntity(workflowId, EntityType.COLUMN,
                    EntityType.columnKey(table.tableName(), e.getKey()));
            if (column.isEmpty()) {
                continue;
            }
            states.updateStateData(column.get().id(), EntityStatus.SCANNED, e.getValue());
        }
        Map<String, Object> tableData = new LinkedHashMap<>();
        tableData.put("row_count", table.rowCount());
        tableData.put("column_count", columns.size());
        states.updateStateData(stateId, EntityStatus.SCANNED, tableData);
        log.debug("Scanned {} columns of {}", gathered.size(), table.qualifiedName());
    }

    @Override
    protected void onFailure(String message) {
        TableEntities.failColumns(states, workflowId, table.tableName(), columns, message);
    }
}
