package io.ontomesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class DatasourceStore {
    private final Database database;

    public DatasourceStore(Database database) {
        this.database = database;
    }

    public Datasource register(String projectId, String name, String jdbcUrl) {
        Datasource ds = new Datasource(UUID.randomUUID().toString(), projectId, name == null ? "" : name, jdbcUrl,
                Instant.now().toEpochMilli());
        SqlSupport.exec(database,
                "INSERT INTO datasources(datasource_id,project_id,name,jdbc_url,created_at_ms) VALUES(?,?,?,?,?)",
                ps -> {
                    ps.setString(1, ds.id());
                    ps.setString(2, ds.projectId());
                    ps.setString(3, ds.name());
                    ps.setString(4, ds.jdbcUrl());
                    ps.setLong(5, ds.createdAtMs());
                }, "Failed to register datasource");
        return ds;
    }

    public Optional<Datasource> get(String datasourceId) {
        List<Datasource> rows = query("SELECT datasource_id,project_id,name,jdbc_url,created_at_ms FROM datasources WHERE datasource_id=?",
                datasourceId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Datasource> listByProject(String projectId) {
        return query("SELECT datasource_id,project_id,name,jdbc_url,created_at_ms FROM datasources WHERE project_id=? ORDER BY created_at_ms",
                projectId);
    }

    private List<Datasource> query(String sql, String key) {
        List<Datasource> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Datasource(
                            rs.getString("datasource_id"),
                            rs.getString("project_id"),
                            rs.getString("name"),
                            rs.getString("jdbc_url"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read datasources", e);
        }
    }

    public record Datasource(String id, String projectId, String name, String jdbcUrl, long createdAtMs) {
    }
}
