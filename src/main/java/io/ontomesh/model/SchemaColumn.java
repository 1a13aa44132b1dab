package io.ontomesh.model;

public record SchemaColumn(
        String id,
        String tableId,
        String columnName,
        String dataType,
        boolean primaryKey,
        String fkTargetTable,
        String fkTargetColumn,
        int ordinal
) {
    public boolean hasForeignKeyHint() {
        return fkTargetTable != null && !fkTargetTable.isBlank();
    }
}
