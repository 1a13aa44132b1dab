package io.ontomesh.schema;

import java.util.List;

/**
 * Live queries against a datasource. Implementations hold a connection and must be closed.
 */
public interface SchemaDiscoverer extends AutoCloseable {
    List<ColumnStats> analyzeColumnStats(String schemaName, String tableName, List<String> columnNames) throws Exception;

    List<String> distinctValues(String schemaName, String tableName, String columnName, int limit) throws Exception;

    ValueOverlapResult analyzeValueOverlap(ColumnRef source, ColumnRef target, int sampleSize) throws Exception;

    JoinAnalysis analyzeJoin(ColumnRef source, ColumnRef target) throws Exception;

    DiscoveredSchema importSchema() throws Exception;

    @Override
    void close();
}
