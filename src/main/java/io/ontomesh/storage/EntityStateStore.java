package io.ontomesh.storage;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class EntityStateStore {
    private static final String COLUMNS = """
            state_id,workflow_id,entity_type,entity_key,status,retry_count,last_error,state_data,
            created_at_ms,updated_at_ms
            """;

    private final Database database;

    public EntityStateStore(Database database) {
        this.database = database;
    }

    public void createBatch(String projectId, List<EntityState> states) {
        if (states.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO workflow_entity_states(state_id,workflow_id,project_id,entity_type,entity_key,status,
                    retry_count,last_error,state_data,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (EntityState s : states) {
                    ps.setString(1, s.id());
                    ps.setString(2, s.workflowId());
                    ps.setString(3, projectId);
                    ps.setString(4, s.entityType().wire());
                    ps.setString(5, s.entityKey());
                    ps.setString(6, s.status().wire());
                    ps.setInt(7, s.retryCount());
                    ps.setString(8, s.lastError());
                    ps.setString(9, Jsons.toCompactJson(s.stateData()));
                    ps.setLong(10, s.createdAtMs());
                    ps.setLong(11, s.updatedAtMs());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create entity states", e);
        }
    }

    public List<EntityState> listByWorkflow(String workflowId) {
        String sql = "SELECT " + COLUMNS + " FROM workflow_entity_states WHERE workflow_id=? ORDER BY created_at_ms, rowid";
        List<EntityState> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list entity states", e);
        }
    }

    public Optional<EntityState> getByEntity(String workflowId, EntityType type, String entityKey) {
        String sql = "SELECT " + COLUMNS
                + " FROM workflow_entity_states WHERE workflow_id=? AND entity_type=? AND entity_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            ps.setString(2, type.wire());
            ps.setString(3, entityKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read entity state", e);
        }
    }

    /**
     * Moves an entity to {@code status}. Re-applying the current status is a no-op; a
     * backward move is rejected.
     */
    public void updateStatus(String stateId, EntityStatus status, String lastError) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                EntityStatus current = currentStatus(c, stateId);
                if (current == status && lastError == null) {
                    c.commit();
                    return;
                }
                requireTransition(stateId, current, status);
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE workflow_entity_states SET status=?,last_error=?,updated_at_ms=? WHERE state_id=?")) {
                    ps.setString(1, status.wire());
                    ps.setString(2, lastError);
                    ps.setLong(3, Instant.now().toEpochMilli());
                    ps.setString(4, stateId);
                    ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update entity status", e);
        }
    }

    /**
     * Replaces the state payload and moves the entity to {@code status} in one write.
     */
    public void updateStateData(String stateId, EntityStatus status, Map<String, Object> stateData) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                requireTransition(stateId, currentStatus(c, stateId), status);
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE workflow_entity_states SET status=?,state_data=?,updated_at_ms=? WHERE state_id=?")) {
                    ps.setString(1, status.wire());
                    ps.setString(2, Jsons.toCompactJson(stateData == null ? Map.of() : stateData));
                    ps.setLong(3, Instant.now().toEpochMilli());
                    ps.setString(4, stateId);
                    ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update entity state data", e);
        }
    }

    public void incrementRetry(String stateId, String lastError) {
        SqlSupport.exec(database,
                "UPDATE workflow_entity_states SET retry_count=retry_count+1,last_error=?,updated_at_ms=? WHERE state_id=?",
                ps -> {
                    ps.setString(1, lastError);
                    ps.setLong(2, Instant.now().toEpochMilli());
                    ps.setString(3, stateId);
                }, "Failed to increment entity retry count");
    }

    public int deleteByWorkflow(String workflowId) {
        return SqlSupport.exec(database, "DELETE FROM workflow_entity_states WHERE workflow_id=?",
                ps -> ps.setString(1, workflowId), "Failed to delete entity states");
    }

    /**
     * Lazy cleanup of the entity states left by a project's earlier workflows of one phase.
     */
    public int deleteByProject(String projectId, WorkflowPhase phase) {
        String sql = """
                DELETE FROM workflow_entity_states WHERE project_id=?
                  AND workflow_id IN (SELECT workflow_id FROM workflows WHERE project_id=? AND phase=?)
                """;
        return SqlSupport.exec(database, sql, ps -> {
            ps.setString(1, projectId);
            ps.setString(2, projectId);
            ps.setString(3, phase.wire());
        }, "Failed to delete project entity states");
    }

    private EntityStatus currentStatus(Connection c, String stateId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM workflow_entity_states WHERE state_id=?")) {
            ps.setString(1, stateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("entity state not found: " + stateId);
                }
                return EntityStatus.fromWire(rs.getString(1));
            }
        }
    }

    private void requireTransition(String stateId, EntityStatus from, EntityStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException(
                    "invalid entity transition " + from.wire() + " -> " + to.wire() + " for " + stateId);
        }
    }

    private EntityState read(ResultSet rs) throws SQLException {
        return new EntityState(
                rs.getString("state_id"),
                rs.getString("workflow_id"),
                EntityType.fromWire(rs.getString("entity_type")),
                rs.getString("entity_key"),
                EntityStatus.fromWire(rs.getString("status")),
                rs.getInt("retry_count"),
                rs.getString("last_error"),
                Jsons.toMap(rs.getString("state_data")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
