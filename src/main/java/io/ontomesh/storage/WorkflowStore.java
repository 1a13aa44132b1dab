package io.ontomesh.storage;

import io.ontomesh.model.LeaseLostException;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Workflow rows plus the ownership lease stored on them. Lease changes are single
 * conditional updates so two servers racing for the same workflow cannot both win.
 */
public final class WorkflowStore {
    private static final String COLUMNS = """
            workflow_id,project_id,datasource_id,phase,state,progress,owner_id,last_heartbeat_ms,
            error_message,created_at_ms,updated_at_ms
            """;

    private final Database database;

    public WorkflowStore(Database database) {
        this.database = database;
    }

    public void create(Workflow workflow) {
        String sql = """
                INSERT INTO workflows(workflow_id,project_id,datasource_id,phase,state,progress,owner_id,
                    last_heartbeat_ms,error_message,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        SqlSupport.exec(database, sql, ps -> {
            ps.setString(1, workflow.id());
            ps.setString(2, workflow.projectId());
            ps.setString(3, workflow.datasourceId());
            ps.setString(4, workflow.phase().wire());
            ps.setString(5, workflow.state().wire());
            ps.setString(6, Jsons.toCompactJson(workflow.progress()));
            ps.setString(7, workflow.ownerId());
            if (workflow.lastHeartbeatMs() > 0L) {
                ps.setLong(8, workflow.lastHeartbeatMs());
            } else {
                ps.setNull(8, Types.INTEGER);
            }
            ps.setString(9, workflow.errorMessage());
            ps.setLong(10, workflow.createdAtMs());
            ps.setLong(11, workflow.updatedAtMs());
        }, "Failed to create workflow");
    }

    public Optional<Workflow> get(String workflowId) {
        String sql = "SELECT " + COLUMNS + " FROM workflows WHERE workflow_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read workflow", e);
        }
    }

    public Optional<Workflow> getLatestByProject(String projectId, WorkflowPhase phase) {
        return latest("project_id", projectId, phase);
    }

    public Optional<Workflow> getLatestByDatasource(String datasourceId, WorkflowPhase phase) {
        return latest("datasource_id", datasourceId, phase);
    }

    public List<Workflow> listByProject(String projectId) {
        String sql = "SELECT " + COLUMNS + " FROM workflows WHERE project_id=? ORDER BY created_at_ms";
        List<Workflow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list workflows", e);
        }
    }

    public void updateState(String workflowId, WorkflowState state, String errorMessage) {
        SqlSupport.exec(database, "UPDATE workflows SET state=?,error_message=?,updated_at_ms=? WHERE workflow_id=?", ps -> {
            ps.setString(1, state.wire());
            ps.setString(2, errorMessage);
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.setString(4, workflowId);
        }, "Failed to update workflow state");
    }

    public void updateProgress(String workflowId, WorkflowProgress progress) {
        SqlSupport.exec(database, "UPDATE workflows SET progress=?,updated_at_ms=? WHERE workflow_id=?", ps -> {
            ps.setString(1, Jsons.toCompactJson(progress));
            ps.setLong(2, Instant.now().toEpochMilli());
            ps.setString(3, workflowId);
        }, "Failed to update workflow progress");
    }

    public void updateTaskQueue(String workflowId, String taskQueueJson) {
        SqlSupport.exec(database, "UPDATE workflows SET task_queue=? WHERE workflow_id=?", ps -> {
            ps.setString(1, taskQueueJson);
            ps.setString(2, workflowId);
        }, "Failed to update workflow task queue");
    }

    public String taskQueue(String workflowId) {
        String sql = "SELECT task_queue FROM workflows WHERE workflow_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : "[]";
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read workflow task queue", e);
        }
    }

    /**
     * Takes the lease when nobody holds it, the caller already holds it, or the holder's
     * heartbeat is older than {@code leaseTimeoutMs}.
     */
    public boolean claimOwnership(String workflowId, String ownerId, long nowMs, long leaseTimeoutMs) {
        String sql = """
                UPDATE workflows SET owner_id=?,last_heartbeat_ms=?,updated_at_ms=?
                WHERE workflow_id=?
                  AND (owner_id IS NULL OR owner_id=? OR last_heartbeat_ms IS NULL OR last_heartbeat_ms<?)
                """;
        return SqlSupport.exec(database, sql, ps -> {
            ps.setString(1, ownerId);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, workflowId);
            ps.setString(5, ownerId);
            ps.setLong(6, nowMs - leaseTimeoutMs);
        }, "Failed to claim workflow ownership") == 1;
    }

    /**
     * @throws LeaseLostException when the workflow is gone or owned by someone else
     */
    public void updateHeartbeat(String workflowId, String ownerId, long nowMs) {
        int updated = SqlSupport.exec(database,
                "UPDATE workflows SET last_heartbeat_ms=? WHERE workflow_id=? AND owner_id=?", ps -> {
                    ps.setLong(1, nowMs);
                    ps.setString(2, workflowId);
                    ps.setString(3, ownerId);
                }, "Failed heartbeat");
        if (updated != 1) {
            throw new LeaseLostException(workflowId);
        }
    }

    public void releaseOwnership(String workflowId) {
        SqlSupport.exec(database,
                "UPDATE workflows SET owner_id=NULL,last_heartbeat_ms=NULL,updated_at_ms=? WHERE workflow_id=?", ps -> {
                    ps.setLong(1, Instant.now().toEpochMilli());
                    ps.setString(2, workflowId);
                }, "Failed to release workflow ownership");
    }

    public boolean delete(String workflowId) {
        return SqlSupport.exec(database, "DELETE FROM workflows WHERE workflow_id=?",
                ps -> ps.setString(1, workflowId), "Failed to delete workflow") == 1;
    }

    private Optional<Workflow> latest(String keyColumn, String key, WorkflowPhase phase) {
        String sql = "SELECT " + COLUMNS + " FROM workflows WHERE " + keyColumn
                + "=? AND phase=? ORDER BY created_at_ms DESC, rowid DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, phase.wire());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read latest workflow", e);
        }
    }

    private Workflow read(ResultSet rs) throws SQLException {
        Long heartbeat = SqlSupport.nullableLong(rs, "last_heartbeat_ms");
        return new Workflow(
                rs.getString("workflow_id"),
                rs.getString("project_id"),
                rs.getString("datasource_id"),
                WorkflowPhase.fromWire(rs.getString("phase")),
                WorkflowState.fromWire(rs.getString("state")),
                Jsons.fromJson(rs.getString("progress"), WorkflowProgress.class),
                rs.getString("owner_id"),
                heartbeat == null ? 0L : heartbeat,
                rs.getString("error_message"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
