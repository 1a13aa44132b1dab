package io.ontomesh.schema;

import java.util.List;

public record DiscoveredSchema(List<Table> tables) {
    public record Table(String schemaName, String tableName, Long rowCount, List<Column> columns) {
    }

    public record Column(
            String columnName,
            String dataType,
            boolean primaryKey,
            String fkTargetTable,
            String fkTargetColumn,
            int ordinal
    ) {
    }
}
