package io.ontomesh.schema;

public record ColumnRef(String schemaName, String tableName, String columnName) {
    @Override
    public String toString() {
        String table = schemaName == null || schemaName.isBlank() ? tableName : schemaName + "." + tableName;
        return table + "." + columnName;
    }
}
