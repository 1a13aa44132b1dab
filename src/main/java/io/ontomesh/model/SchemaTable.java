package io.ontomesh.model;

public record SchemaTable(
        String id,
        String datasourceId,
        String schemaName,
        String tableName,
        Long rowCount
) {
    public String qualifiedName() {
        if (schemaName == null || schemaName.isBlank()) {
            return tableName;
        }
        return schemaName + "." + tableName;
    }
}
