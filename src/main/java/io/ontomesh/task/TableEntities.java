package io.ontomesh.task;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.SchemaColumn;
import io.ontomesh.storage.EntityStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TableEntities {
    private static final Logger log = LoggerFactory.getLogger(TableEntities.class);

    private TableEntities() {
    }

    /**
     * Fails the non-terminal column entities of a failed table so the workflow can still
     * reach an all-terminal state.
     */
    public static void failColumns(
            EntityStateStore states,
            String workflowId,
            String tableName,
            List<SchemaColumn> columns,
            String message
    ) {
        for (SchemaColumn c : columns) {
            Optional<EntityState> column = states.getByEntity(workflowId, EntityType.COLUMN,
                    EntityType.columnKey(tableName, c.columnName()));
            if (column.isPresent() && !column.get().status().isTerminal()) {
                states.updateStatus(column.get().id(), EntityStatus.FAILED, "table failed: " + message);
            }
        }
    }

    /**
     * Walks every non-terminal column entity of a table forward to {@code complete}.
     */
    public static int completeColumns(EntityStateStore states, String workflowId, String tableName, List<SchemaColumn> columns) {
        int completed = 0;
        for (SchemaColumn c : columns) {
            Optional<EntityState> column = states.getByEntity(workflowId, EntityType.COLUMN,
                    EntityType.columnKey(tableName, c.columnName()));
            if (column.isEmpty() || column.get().status().isTerminal()) {
                continue;
            }
            completeColumn(states, column.get().id(), column.get().status());
            completed++;
        }
        return completed;
    }

    /**
     * Brings non-terminal columns in line with their already finished table: complete under a
     * complete table, failed under a failed or cancelled one. A column whose update fails is
     * left for the next pass.
     *
     * @return the number of columns moved to a terminal status
     */
    public static int settleColumns(EntityStateStore states, List<EntityState> entities) {
        Map<String, EntityState> tables = new HashMap<>();
        for (EntityState s : entities) {
            if (s.entityType() == EntityType.TABLE) {
                tables.put(s.entityKey(), s);
            }
        }
        int settled = 0;
        for (EntityState s : entities) {
            if (s.entityType() != EntityType.COLUMN || s.status().isTerminal()) {
                continue;
            }
            int dot = s.entityKey().lastIndexOf('.');
            EntityState table = dot < 0 ? null : tables.get(s.entityKey().substring(0, dot));
            if (table == null || !table.status().isTerminal()) {
                continue;
            }
            try {
                if (table.status() == EntityStatus.COMPLETE) {
                    completeColumn(states, s.id(), s.status());
                } else {
                    String reason = table.lastError() == null ? table.status().wire() : table.lastError();
                    states.updateStatus(s.id(), EntityStatus.FAILED, "table failed: " + reason);
                }
                settled++;
            } catch (RuntimeException e) {
                log.warn("Could not settle column {} of finished table {}: {}", s.entityKey(), table.entityKey(), e.getMessage());
            }
        }
        return settled;
    }

    private static void completeColumn(EntityStateStore states, String id, EntityStatus status) {
        if (status == EntityStatus.PENDING) {
            states.updateStatus(id, EntityStatus.SCANNED, null);
            status = EntityStatus.SCANNED;
        }
        if (status == EntityStatus.SCANNED || status == EntityStatus.NEEDS_INPUT) {
            states.updateStatus(id, EntityStatus.ANALYZING, null);
        }
        states.updateStatus(id, EntityStatus.COMPLETE, null);
    }
}
