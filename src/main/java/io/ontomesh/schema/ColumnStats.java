package io.ontomesh.schema;

public record ColumnStats(String columnName, long rowCount, long nonNullCount, long distinctCount) {
}
