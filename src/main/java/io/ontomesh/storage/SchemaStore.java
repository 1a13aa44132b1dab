package io.ontomesh.storage;

import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaRelationship;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.schema.DiscoveredSchema;
import io.ontomesh.schema.SchemaRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stored schema inventory. Tables and columns are written by schema import; relationships
 * are written when a detection workflow is saved.
 */
public final class SchemaStore implements SchemaRepository {
    private static final String TABLE_COLUMNS = "table_id,datasource_id,schema_name,table_name,row_count";
    private static final String COLUMN_COLUMNS = """
            c.column_id,c.table_id,c.column_name,c.data_type,c.is_primary_key,c.fk_target_table,
            c.fk_target_column,c.ordinal
            """;
    private static final String RELATIONSHIP_COLUMNS = """
            relationship_id,datasource_id,source_column_id,target_column_id,relationship_type,cardinality,
            inference_method,confidence,description,match_rate,matched_count
            """;

    private final Database database;

    public SchemaStore(Database database) {
        this.database = database;
    }

    /**
     * Replaces the tables and columns stored for a datasource with a fresh import.
     * Tables and columns that survive the re-import keep their ids, so stored
     * relationships and candidates stay resolvable.
     *
     * @return the number of tables written
     */
    public int replaceSchema(String datasourceId, DiscoveredSchema schema) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Map<String, String> tableIds = new HashMap<>();
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT table_id,schema_name,table_name FROM schema_tables WHERE datasource_id=?")) {
                    ps.setString(1, datasourceId);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            tableIds.put(rs.getString("schema_name") + "." + rs.getString("table_name"), rs.getString("table_id"));
                        }
                    }
                }
                Map<String, String> columnIds = new HashMap<>();
                for (String tableId : tableIds.values()) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "SELECT column_id,column_name FROM schema_columns WHERE table_id=?")) {
                        ps.setString(1, tableId);
                        try (ResultSet rs = ps.executeQuery()) {
                            while (rs.next()) {
                                columnIds.put(tableId + "." + rs.getString("column_name"), rs.getString("column_id"));
                            }
                        }
                    }
                    try (PreparedStatement ps = c.prepareStatement("DELETE FROM schema_columns WHERE table_id=?")) {
                        ps.setString(1, tableId);
                        ps.executeUpdate();
                    }
                }
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM schema_tables WHERE datasource_id=?")) {
                    ps.setString(1, datasourceId);
                    ps.executeUpdate();
                }
                for (DiscoveredSchema.Table table : schema.tables()) {
                    String schemaName = table.schemaName() == null ? "" : table.schemaName();
                    String tableId = tableIds.getOrDefault(schemaName + "." + table.tableName(), UUID.randomUUID().toString());
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT INTO schema_tables(" + TABLE_COLUMNS + ") VALUES(?,?,?,?,?)")) {
                        ps.setString(1, tableId);
                        ps.setString(2, datasourceId);
                        ps.setString(3, schemaName);
                        ps.setString(4, table.tableName());
                        SqlSupport.setNullableLong(ps, 5, table.rowCount());
                        ps.executeUpdate();
                    }
                    try (PreparedStatement ps = c.prepareStatement("""
                            INSERT INTO schema_columns(column_id,table_id,column_name,data_type,is_primary_key,
                                fk_target_table,fk_target_column,ordinal)
                            VALUES(?,?,?,?,?,?,?,?)
                            """)) {
                        for (DiscoveredSchema.Column column : table.columns()) {
                            ps.setString(1, columnIds.getOrDefault(tableId + "." + column.columnName(),
                                    UUID.randomUUID().toString()));
                            ps.setString(2, tableId);
                            ps.setString(3, column.columnName());
                            ps.setString(4, column.dataType() == null ? "" : column.dataType());
                            ps.setInt(5, column.primaryKey() ? 1 : 0);
                            ps.setString(6, column.fkTargetTable());
                            ps.setString(7, column.fkTargetColumn());
                            ps.setInt(8, column.ordinal());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }
                c.commit();
                return schema.tables().size();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to replace schema for datasource " + datasourceId, e);
        }
    }

    @Override
    public List<SchemaTable> listTablesByDatasource(String datasourceId) {
        String sql = "SELECT " + TABLE_COLUMNS + " FROM schema_tables WHERE datasource_id=? ORDER BY schema_name, table_name";
        List<SchemaTable> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, datasourceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTable(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema tables", e);
        }
    }

    @Override
    public List<SchemaColumn> listColumnsByDatasource(String datasourceId) {
        String sql = "SELECT " + COLUMN_COLUMNS + """
                 FROM schema_columns c JOIN schema_tables t ON t.table_id=c.table_id
                WHERE t.datasource_id=? ORDER BY t.schema_name, t.table_name, c.ordinal
                """;
        List<SchemaColumn> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, datasourceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readColumn(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema columns", e);
        }
    }

    @Override
    public Optional<SchemaTable> getTable(String tableId) {
        String sql = "SELECT " + TABLE_COLUMNS + " FROM schema_tables WHERE table_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tableId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readTable(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema table", e);
        }
    }

    @Override
    public Optional<SchemaColumn> getColumn(String columnId) {
        String sql = "SELECT " + COLUMN_COLUMNS + " FROM schema_columns c WHERE c.column_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, columnId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readColumn(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema column", e);
        }
    }

    @Override
    public void upsertRelationships(List<SchemaRelationship> relationships) {
        if (relationships.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO schema_relationships(relationship_id,datasource_id,source_column_id,target_column_id,
                    relationship_type,cardinality,inference_method,confidence,description,match_rate,matched_count,
                    updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(source_column_id,target_column_id) DO UPDATE SET
                    relationship_type=excluded.relationship_type,
                    cardinality=excluded.cardinality,
                    inference_method=excluded.inference_method,
                    confidence=excluded.confidence,
                    description=excluded.description,
                    match_rate=excluded.match_rate,
                    matched_count=excluded.matched_count,
                    updated_at_ms=excluded.updated_at_ms
                """;
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (SchemaRelationship r : relationships) {
                    ps.setString(1, r.id() == null ? UUID.randomUUID().toString() : r.id());
                    ps.setString(2, r.datasourceId());
                    ps.setString(3, r.sourceColumnId());
                    ps.setString(4, r.targetColumnId());
                    ps.setString(5, r.relationshipType());
                    ps.setString(6, r.cardinality());
                    ps.setString(7, r.inferenceMethod());
                    ps.setDouble(8, r.confidence());
                    ps.setString(9, r.description());
                    SqlSupport.setNullableDouble(ps, 10, r.matchRate());
                    SqlSupport.setNullableLong(ps, 11, r.matchedCount());
                    ps.setLong(12, nowMs);
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
            throw new RuntimeException("Failed to upsert schema relationships", e);
        }
    }

    @Override
    public List<SchemaRelationship> listRelationships(String datasourceId) {
        String sql = "SELECT " + RELATIONSHIP_COLUMNS + " FROM schema_relationships WHERE datasource_id=? ORDER BY updated_at_ms, rowid";
        List<SchemaRelationship> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, datasourceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaRelationship(
                            rs.getString("relationship_id"),
                            rs.getString("datasource_id"),
                            rs.getString("source_column_id"),
                            rs.getString("target_column_id"),
                            rs.getString("relationship_type"),
                            rs.getString("cardinality"),
                            rs.getString("inference_method"),
                            rs.getDouble("confidence"),
                            rs.getString("description"),
                            SqlSupport.nullableDouble(rs, "match_rate"),
                            SqlSupport.nullableLong(rs, "matched_count")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema relationships", e);
        }
    }

    private SchemaTable readTable(ResultSet rs) throws SQLException {
        return new SchemaTable(
                rs.getString("table_id"),
                rs.getString("datasource_id"),
                rs.getString("schema_name"),
                rs.getString("table_name"),
                SqlSupport.nullableLong(rs, "row_count")
        );
    }

    private SchemaColumn readColumn(ResultSet rs) throws SQLException {
        return new SchemaColumn(
                rs.getString("column_id"),
                rs.getString("table_id"),
                rs.getString("column_name"),
                rs.getString("data_type"),
                rs.getInt("is_primary_key") == 1,
                rs.getString("fk_target_table"),
                rs.getString("fk_target_column"),
                rs.getInt("ordinal")
        );
    }
}
