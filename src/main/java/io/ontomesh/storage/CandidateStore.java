package io.ontomesh.storage;

import io.ontomesh.model.CandidateStatus;
import io.ontomesh.model.DetectionMethod;
import io.ontomesh.model.RelationshipCandidate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class CandidateStore {
    private static final String COLUMNS = """
            candidate_id,workflow_id,datasource_id,source_column_id,target_column_id,detection_method,confidence,
            value_match_rate,cardinality,join_match_rate,orphan_rate,target_coverage,source_row_count,
            target_row_count,matched_rows,orphan_rows,description,is_required,status,user_decision,
            created_at_ms,updated_at_ms
            """;

    private final Database database;

    public CandidateStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts the candidate unless the workflow already has one for the same column pair.
     *
     * @return true when a row was inserted
     */
    public boolean create(RelationshipCandidate c) {
        String sql = "INSERT OR IGNORE INTO relationship_candidates(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        return SqlSupport.exec(database, sql, ps -> {
            ps.setString(1, c.id());
            ps.setString(2, c.workflowId());
            ps.setString(3, c.datasourceId());
            ps.setString(4, c.sourceColumnId());
            ps.setString(5, c.targetColumnId());
            ps.setString(6, c.detectionMethod().wire());
            ps.setDouble(7, c.confidence());
            SqlSupport.setNullableDouble(ps, 8, c.valueMatchRate());
            ps.setString(9, c.cardinality());
            SqlSupport.setNullableDouble(ps, 10, c.joinMatchRate());
            SqlSupport.setNullableDouble(ps, 11, c.orphanRate());
            SqlSupport.setNullableDouble(ps, 12, c.targetCoverage());
            SqlSupport.setNullableLong(ps, 13, c.sourceRowCount());
            SqlSupport.setNullableLong(ps, 14, c.targetRowCount());
            SqlSupport.setNullableLong(ps, 15, c.matchedRows());
            SqlSupport.setNullableLong(ps, 16, c.orphanRows());
            ps.setString(17, c.description());
            ps.setInt(18, c.required() ? 1 : 0);
            ps.setString(19, c.status().wire());
            ps.setString(20, c.userDecision());
            ps.setLong(21, c.createdAtMs());
            ps.setLong(22, c.updatedAtMs());
        }, "Failed to create relationship candidate") == 1;
    }

    public Optional<RelationshipCandidate> get(String candidateId) {
        List<RelationshipCandidate> rows = query("SELECT " + COLUMNS + " FROM relationship_candidates WHERE candidate_id=?",
                ps -> ps.setString(1, candidateId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<RelationshipCandidate> getByWorkflow(String workflowId) {
        return query("SELECT " + COLUMNS + " FROM relationship_candidates WHERE workflow_id=? ORDER BY created_at_ms, rowid",
                ps -> ps.setString(1, workflowId));
    }

    public List<RelationshipCandidate> getByWorkflowAndStatus(String workflowId, CandidateStatus status) {
        return query("SELECT " + COLUMNS
                        + " FROM relationship_candidates WHERE workflow_id=? AND status=? ORDER BY created_at_ms, rowid",
                ps -> {
                    ps.setString(1, workflowId);
                    ps.setString(2, status.wire());
                });
    }

    public boolean exists(String workflowId, String sourceColumnId, String targetColumnId) {
        String sql = "SELECT 1 FROM relationship_candidates WHERE workflow_id=? AND source_column_id=? AND target_column_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            ps.setString(2, sourceColumnId);
            ps.setString(3, targetColumnId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check relationship candidate", e);
        }
    }

    public int countRequiredPending(String workflowId) {
        String sql = "SELECT COUNT(*) FROM relationship_candidates WHERE workflow_id=? AND is_required=1 AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            ps.setString(2, CandidateStatus.PENDING.wire());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count required pending candidates", e);
        }
    }

    /**
     * Confirmed are accepted candidates, needs-review are pending ones flagged required.
     */
    public CandidateCounts countsByWorkflow(String workflowId) {
        String sql = """
                SELECT
                    COALESCE(SUM(CASE WHEN status='accepted' THEN 1 ELSE 0 END),0) AS confirmed,
                    COALESCE(SUM(CASE WHEN status='pending' AND is_required=1 THEN 1 ELSE 0 END),0) AS needs_review,
                    COALESCE(SUM(CASE WHEN status='rejected' THEN 1 ELSE 0 END),0) AS rejected
                FROM relationship_candidates WHERE workflow_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new CandidateCounts(0, 0, 0);
                }
                return new CandidateCounts(rs.getInt("confirmed"), rs.getInt("needs_review"), rs.getInt("rejected"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count relationship candidates", e);
        }
    }

    public void update(RelationshipCandidate c) {
        String sql = """
                UPDATE relationship_candidates SET detection_method=?,confidence=?,value_match_rate=?,cardinality=?,
                    join_match_rate=?,orphan_rate=?,target_coverage=?,source_row_count=?,target_row_count=?,
                    matched_rows=?,orphan_rows=?,description=?,is_required=?,status=?,user_decision=?,updated_at_ms=?
                WHERE candidate_id=?
                """;
        SqlSupport.exec(database, sql, ps -> {
            ps.setString(1, c.detectionMethod().wire());
            ps.setDouble(2, c.confidence());
            SqlSupport.setNullableDouble(ps, 3, c.valueMatchRate());
            ps.setString(4, c.cardinality());
            SqlSupport.setNullableDouble(ps, 5, c.joinMatchRate());
            SqlSupport.setNullableDouble(ps, 6, c.orphanRate());
            SqlSupport.setNullableDouble(ps, 7, c.targetCoverage());
            SqlSupport.setNullableLong(ps, 8, c.sourceRowCount());
            SqlSupport.setNullableLong(ps, 9, c.targetRowCount());
            SqlSupport.setNullableLong(ps, 10, c.matchedRows());
            SqlSupport.setNullableLong(ps, 11, c.orphanRows());
            ps.setString(12, c.description());
            ps.setInt(13, c.required() ? 1 : 0);
            ps.setString(14, c.status().wire());
            ps.setString(15, c.userDecision());
            ps.setLong(16, Instant.now().toEpochMilli());
            ps.setString(17, c.id());
        }, "Failed to update relationship candidate");
    }

    /**
     * Records a human decision; a decided candidate no longer blocks the save gate.
     */
    public void updateStatus(String candidateId, CandidateStatus status, String userDecision) {
        SqlSupport.exec(database,
                "UPDATE relationship_candidates SET status=?,user_decision=?,is_required=0,updated_at_ms=? WHERE candidate_id=?",
                ps -> {
                    ps.setString(1, status.wire());
                    ps.setString(2, userDecision);
                    ps.setLong(3, Instant.now().toEpochMilli());
                    ps.setString(4, candidateId);
                }, "Failed to update relationship candidate status");
    }

    public int deleteByWorkflow(String workflowId) {
        return SqlSupport.exec(database, "DELETE FROM relationship_candidates WHERE workflow_id=?",
                ps -> ps.setString(1, workflowId), "Failed to delete relationship candidates");
    }

    private List<RelationshipCandidate> query(String sql, SqlSupport.Binder binder) {
        List<RelationshipCandidate> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(read(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read relationship candidates", e);
        }
    }

    private RelationshipCandidate read(ResultSet rs) throws SQLException {
        return new RelationshipCandidate(
                rs.getString("candidate_id"),
                rs.getString("workflow_id"),
                rs.getString("datasource_id"),
                rs.getString("source_column_id"),
                rs.getString("target_column_id"),
                DetectionMethod.fromWire(rs.getString("detection_method")),
                rs.getDouble("confidence"),
                SqlSupport.nullableDouble(rs, "value_match_rate"),
                rs.getString("cardinality"),
                SqlSupport.nullableDouble(rs, "join_match_rate"),
                SqlSupport.nullableDouble(rs, "orphan_rate"),
                SqlSupport.nullableDouble(rs, "target_coverage"),
                SqlSupport.nullableLong(rs, "source_row_count"),
                SqlSupport.nullableLong(rs, "target_row_count"),
                SqlSupport.nullableLong(rs, "matched_rows"),
                SqlSupport.nullableLong(rs, "orphan_rows"),
                rs.getString("description"),
                rs.getInt("is_required") == 1,
                CandidateStatus.fromWire(rs.getString("status")),
                rs.getString("user_decision"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record CandidateCounts(int confirmed, int needsReview, int rejected) {
    }
}
