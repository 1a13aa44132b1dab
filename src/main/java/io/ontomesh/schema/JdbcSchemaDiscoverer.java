package io.ontomesh.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link SchemaDiscoverer} over a plain JDBC connection. Identifiers are double-quoted, so
 * any engine accepting ANSI quoting works; the bundled driver is SQLite.
 */
public final class JdbcSchemaDiscoverer implements SchemaDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaDiscoverer.class);

    private final Connection connection;

    public JdbcSchemaDiscoverer(Connection connection) {
        this.connection = connection;
    }

    public static JdbcSchemaDiscoverer open(String jdbcUrl) throws SQLException {
        return new JdbcSchemaDiscoverer(DriverManager.getConnection(jdbcUrl));
    }

    @Override
    public List<ColumnStats> analyzeColumnStats(String schemaName, String tableName, List<String> columnNames)
            throws SQLException {
        String table = qualified(schemaName, tableName);
        List<ColumnStats> out = new ArrayList<>(columnNames.size());
        for (String column : columnNames) {
            String col = quote(column);
            String sql = "SELECT COUNT(*), COUNT(" + col + "), COUNT(DISTINCT " + col + ") FROM " + table;
            try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
                if (rs.next()) {
                    out.add(new ColumnStats(column, rs.getLong(1), rs.getLong(2), rs.getLong(3)));
                } else {
                    out.add(new ColumnStats(column, 0L, 0L, 0L));
                }
            }
        }
        return out;
    }

    @Override
    public List<String> distinctValues(String schemaName, String tableName, String columnName, int limit)
            throws SQLException {
        String col = quote(columnName);
        String sql = "SELECT DISTINCT CAST(" + col + " AS TEXT) FROM " + qualified(schemaName, tableName)
                + " WHERE " + col + " IS NOT NULL LIMIT ?";
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    @Override
    public ValueOverlapResult analyzeValueOverlap(ColumnRef source, ColumnRef target, int sampleSize)
            throws SQLException {
        String src = quote(source.columnName());
        String tgt = quote(target.columnName());
        String sample = "SELECT DISTINCT CAST(" + src + " AS TEXT) AS v FROM " + qualified(source.schemaName(), source.tableName())
                + " WHERE " + src + " IS NOT NULL LIMIT ?";
        String sql = "SELECT COUNT(*), "
                + "SUM(CASE WHEN sv.v IN (SELECT CAST(" + tgt + " AS TEXT) FROM " + qualified(target.schemaName(), target.tableName())
                + " WHERE " + tgt + " IS NOT NULL) THEN 1 ELSE 0 END) FROM (" + sample + ") sv";
        long sourceDistinct;
        long matched;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, sampleSize));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                sourceDistinct = rs.getLong(1);
                matched = rs.getLong(2);
            }
        }
        long targetDistinct;
        String countSql = "SELECT COUNT(DISTINCT " + tgt + ") FROM " + qualified(target.schemaName(), target.tableName());
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(countSql)) {
            targetDistinct = rs.next() ? rs.getLong(1) : 0L;
        }
        return ValueOverlapResult.of(sourceDistinct, targetDistinct, matched);
    }

    @Override
    public JoinAnalysis analyzeJoin(ColumnRef source, ColumnRef target) throws SQLException {
        String srcTable = qualified(source.schemaName(), source.tableName());
        String tgtTable = qualified(target.schemaName(), target.tableName());
        String src = "s." + quote(source.columnName());
        String tgt = "t." + quote(target.columnName());
        String joinSql = "SELECT COUNT(*), COUNT(DISTINCT " + src + "), COUNT(DISTINCT " + tgt + ") FROM "
                + srcTable + " s JOIN " + tgtTable + " t ON " + src + " = " + tgt;
        String orphanSql = "SELECT COUNT(*) FROM " + srcTable + " s WHERE " + src + " IS NOT NULL AND NOT EXISTS "
                + "(SELECT 1 FROM " + tgtTable + " t WHERE " + tgt + " = " + src + ")";
        long joinCount;
        long sourceMatched;
        long targetMatched;
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(joinSql)) {
            rs.next();
            joinCount = rs.getLong(1);
            sourceMatched = rs.getLong(2);
            targetMatched = rs.getLong(3);
        }
        long orphans;
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(orphanSql)) {
            orphans = rs.next() ? rs.getLong(1) : 0L;
        }
        return new JoinAnalysis(joinCount, sourceMatched, targetMatched, orphans);
    }

    @Override
    public DiscoveredSchema importSchema() throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        List<String[]> tableNames = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (name == null || name.toLowerCase(Locale.ROOT).startsWith("sqlite_")) {
                    continue;
                }
                String schema = rs.getString("TABLE_SCHEM");
                tableNames.add(new String[]{schema == null ? "" : schema, name});
            }
        }
        List<DiscoveredSchema.Table> tables = new ArrayList<>();
        for (String[] entry : tableNames) {
            String schema = entry[0];
            String name = entry[1];
            String schemaArg = schema.isBlank() ? null : schema;
            Set<String> primaryKeys = new HashSet<>();
            try (ResultSet rs = metaData.getPrimaryKeys(null, schemaArg, name)) {
                while (rs.next()) {
                    primaryKeys.add(rs.getString("COLUMN_NAME"));
                }
            }
            Map<String, String[]> foreignKeys = new HashMap<>();
            try (ResultSet rs = metaData.getImportedKeys(null, schemaArg, name)) {
                while (rs.next()) {
                    String pkSchema = rs.getString("PKTABLE_SCHEM");
                    String pkTable = rs.getString("PKTABLE_NAME");
                    String target = pkSchema == null || pkSchema.isBlank() ? pkTable : pkSchema + "." + pkTable;
                    foreignKeys.put(rs.getString("FKCOLUMN_NAME"), new String[]{target, rs.getString("PKCOLUMN_NAME")});
                }
            }
            List<DiscoveredSchema.Column> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(null, schemaArg, name, "%")) {
                while (rs.next()) {
                    String column = rs.getString("COLUMN_NAME");
                    String[] fk = foreignKeys.get(column);
                    columns.add(new DiscoveredSchema.Column(
                            column,
                            rs.getString("TYPE_NAME"),
                            primaryKeys.contains(column),
                            fk == null ? null : fk[0],
                            fk == null ? null : fk[1],
                            rs.getInt("ORDINAL_POSITION")
                    ));
                }
            }
            tables.add(new DiscoveredSchema.Table(schema, name, rowCount(schema, name), columns));
        }
        log.info("Imported {} tables from {}", tables.size(), metaData.getURL());
        return new DiscoveredSchema(tables);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close discoverer connection: {}", e.getMessage());
        }
    }

    private Long rowCount(String schema, String table) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + qualified(schema, table))) {
            return rs.next() ? rs.getLong(1) : null;
        }
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String qualified(String schemaName, String tableName) {
        if (schemaName == null || schemaName.isBlank()) {
            return quote(tableName);
        }
        return quote(schemaName) + "." + quote(tableName);
    }
}
