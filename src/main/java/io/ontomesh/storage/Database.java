package io.ontomesh.storage;

import io.ontomesh.config.OntoMeshConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "ontomesh.schema.migration.v1";
    static final int BUSY_TIMEOUT_MS = 10_000;
    private final OntoMeshConfig config;
    private final String jdbcUrl;

    public Database(OntoMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public OntoMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Transactions begin IMMEDIATE: a read-then-write transaction holds the write lock from its
     * first statement, so concurrent writers wait on the busy timeout instead of failing the
     * lock upgrade with SQLITE_BUSY.
     */
    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionConfig().toProperties());
    }

    static SQLiteConfig connectionConfig() {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return sqlite;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.ontologyRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS datasources (
                        datasource_id TEXT PRIMARY KEY,
                        project_id TEXT NOT NULL,
                        name TEXT NOT NULL DEFAULT '',
                        jdbc_url TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workflows (
                        workflow_id TEXT PRIMARY KEY,
                        project_id TEXT NOT NULL,
                        datasource_id TEXT,
                        phase TEXT NOT NULL,
                        state TEXT NOT NULL,
                        progress TEXT NOT NULL DEFAULT '{}',
                        task_queue TEXT NOT NULL DEFAULT '[]',
                        owner_id TEXT,
                        last_heartbeat_ms INTEGER,
                        error_message TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workflow_entity_states (
                        state_id TEXT PRIMARY KEY,
                        workflow_id TEXT NOT NULL,
                        project_id TEXT NOT NULL,
                        entity_type TEXT NOT NULL,
                        entity_key TEXT NOT NULL,
                        status TEXT NOT NULL,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT,
                        state_data TEXT NOT NULL DEFAULT '{}',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(workflow_id, entity_type, entity_key),
                        FOREIGN KEY(workflow_id) REFERENCES workflows(workflow_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS relationship_candidates (
                        candidate_id TEXT PRIMARY KEY,
                        workflow_id TEXT NOT NULL,
                        datasource_id TEXT NOT NULL,
                        source_column_id TEXT NOT NULL,
                        target_column_id TEXT NOT NULL,
                        detection_method TEXT NOT NULL,
                        confidence REAL NOT NULL,
                        value_match_rate REAL,
                        cardinality TEXT,
                        join_match_rate REAL,
                        orphan_rate REAL,
                        target_coverage REAL,
                        source_row_count INTEGER,
                        target_row_count INTEGER,
                        matched_rows INTEGER,
                        orphan_rows INTEGER,
                        description TEXT,
                        is_required INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        user_decision TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(workflow_id, source_column_id, target_column_id),
                        FOREIGN KEY(workflow_id) REFERENCES workflows(workflow_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_tables (
                        table_id TEXT PRIMARY KEY,
                        datasource_id TEXT NOT NULL,
                        schema_name TEXT NOT NULL DEFAULT '',
                        table_name TEXT NOT NULL,
                        row_count INTEGER,
                        UNIQUE(datasource_id, schema_name, table_name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_columns (
                        column_id TEXT PRIMARY KEY,
                        table_id TEXT NOT NULL,
                        column_name TEXT NOT NULL,
                        data_type TEXT NOT NULL DEFAULT '',
                        is_primary_key INTEGER NOT NULL DEFAULT 0,
                        fk_target_table TEXT,
                        fk_target_column TEXT,
                        ordinal INTEGER NOT NULL DEFAULT 0,
                        UNIQUE(table_id, column_name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_relationships (
                        relationship_id TEXT PRIMARY KEY,
                        datasource_id TEXT NOT NULL,
                        source_column_id TEXT NOT NULL,
                        target_column_id TEXT NOT NULL,
                        relationship_type TEXT NOT NULL,
                        cardinality TEXT NOT NULL,
                        inference_method TEXT NOT NULL,
                        confidence REAL NOT NULL,
                        description TEXT,
                        match_rate REAL,
                        matched_count INTEGER,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(source_column_id, target_column_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ontologies (
                        ontology_id TEXT PRIMARY KEY,
                        project_id TEXT NOT NULL,
                        workflow_id TEXT NOT NULL,
                        content TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureWorkflowColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_workflows_project_phase ON workflows(project_id, phase, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_workflows_datasource_phase ON workflows(datasource_id, phase, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_entity_states_workflow ON workflow_entity_states(workflow_id, entity_type)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_entity_states_project ON workflow_entity_states(project_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_candidates_workflow_status ON relationship_candidates(workflow_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_columns_table ON schema_columns(table_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_ontologies_project ON ontologies(project_id, created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureWorkflowColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(workflows)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("task_queue")) {
                st.execute("ALTER TABLE workflows ADD COLUMN task_queue TEXT NOT NULL DEFAULT '[]'");
            }
            if (!columns.contains("error_message")) {
                st.execute("ALTER TABLE workflows ADD COLUMN error_message TEXT");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_workflow_lease_index",
                "Index workflows by owner heartbeat for lease reclaim scans",
                List.of("CREATE INDEX IF NOT EXISTS idx_workflows_owner_heartbeat ON workflows(owner_id, last_heartbeat_ms)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_candidate_required_index",
                "Index required candidates for the save gate",
                List.of("CREATE INDEX IF NOT EXISTS idx_candidates_required ON relationship_candidates(workflow_id, is_required, status)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
