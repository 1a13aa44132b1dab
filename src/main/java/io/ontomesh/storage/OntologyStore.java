package io.ontomesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Finalized ontology documents, one row per completed extraction.
 */
public final class OntologyStore {
    private final Database database;

    public OntologyStore(Database database) {
        this.database = database;
    }

    public String save(String projectId, String workflowId, String contentJson) {
        String id = UUID.randomUUID().toString();
        SqlSupport.exec(database,
                "INSERT INTO ontologies(ontology_id,project_id,workflow_id,content,created_at_ms) VALUES(?,?,?,?,?)",
                ps -> {
                    ps.setString(1, id);
                    ps.setString(2, projectId);
                    ps.setString(3, workflowId);
                    ps.setString(4, contentJson);
                    ps.setLong(5, Instant.now().toEpochMilli());
                }, "Failed to save ontology");
        return id;
    }

    public Optional<StoredOntology> latest(String projectId) {
        String sql = """
                SELECT ontology_id,project_id,workflow_id,content,created_at_ms FROM ontologies
                WHERE project_id=? ORDER BY created_at_ms DESC, rowid DESC LIMIT 1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StoredOntology(
                        rs.getString("ontology_id"),
                        rs.getString("project_id"),
                        rs.getString("workflow_id"),
                        rs.getString("content"),
                        rs.getLong("created_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read ontology", e);
        }
    }

    public record StoredOntology(String id, String projectId, String workflowId, String content, long createdAtMs) {
    }
}
