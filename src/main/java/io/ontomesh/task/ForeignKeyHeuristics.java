package io.ontomesh.task;

import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.util.Inflector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses the table a column refers to. Explicit FK metadata wins; name patterns are only
 * consulted when the column carries no hint.
 */
public final class ForeignKeyHeuristics {
    static final double ID_SUFFIX_CONFIDENCE = 0.8d;
    static final double TABLE_NAME_CONFIDENCE = 0.7d;
    static final double METADATA_CONFIDENCE = 1.0d;
    private static final String ID_SUFFIX = "_id";
    private static final String DEFAULT_TARGET_COLUMN = "id";

    private final Map<String, SchemaTable> tablesByName;
    private final Map<String, SchemaTable> lookup;
    private final Map<String, List<SchemaColumn>> columnsByTable;

    public ForeignKeyHeuristics(List<SchemaTable> tables, List<SchemaColumn> columns) {
        this.columnsByTable = new HashMap<>();
        for (SchemaColumn c : columns) {
            columnsByTable.computeIfAbsent(c.tableId(), k -> new ArrayList<>()).add(c);
        }
        this.tablesByName = new LinkedHashMap<>();
        this.lookup = new LinkedHashMap<>();
        for (SchemaTable t : tables) {
            String name = t.tableName().toLowerCase(Locale.ROOT);
            tablesByName.putIfAbsent(name, t);
            if (primaryKey(t).isEmpty()) {
                continue;
            }
            lookup.putIfAbsent(name, t);
            lookup.putIfAbsent(Inflector.singularize(name), t);
            lookup.putIfAbsent(Inflector.pluralize(name), t);
        }
    }

    public Optional<Match> detect(SchemaTable ownTable, SchemaColumn column) {
        if (column.hasForeignKeyHint()) {
            return fromMetadata(ownTable, column);
        }
        return fromName(ownTable, column);
    }

    Optional<Match> fromMetadata(SchemaTable ownTable, SchemaColumn column) {
        String target = column.fkTargetTable().trim();
        int dot = target.lastIndexOf('.');
        if (dot >= 0) {
            target = target.substring(dot + 1);
        }
        SchemaTable table = tablesByName.get(target.toLowerCase(Locale.ROOT));
        if (table == null) {
            return Optional.empty();
        }
        String targetColumn = column.fkTargetColumn();
        if (targetColumn == null || targetColumn.isBlank()) {
            targetColumn = primaryKey(table).map(SchemaColumn::columnName).orElse(DEFAULT_TARGET_COLUMN);
        }
        Optional<SchemaColumn> resolved = column(table, targetColumn);
        if (resolved.isEmpty() || resolved.get().id().equals(column.id())) {
            return Optional.empty();
        }
        return Optional.of(new Match(table, resolved.get(), METADATA_CONFIDENCE, true));
    }

    Optional<Match> fromName(SchemaTable ownTable, SchemaColumn column) {
        if (column.primaryKey()) {
            return Optional.empty();
        }
        String name = column.columnName().toLowerCase(Locale.ROOT);
        SchemaTable target = null;
        double confidence = 0.0d;
        if (name.endsWith(ID_SUFFIX) && name.length() > ID_SUFFIX.length()) {
            target = lookup.get(name.substring(0, name.length() - ID_SUFFIX.length()));
            confidence = ID_SUFFIX_CONFIDENCE;
        }
        if (target == null) {
            target = lookup.get(name);
            confidence = TABLE_NAME_CONFIDENCE;
        }
        if (target == null || target.id().equals(ownTable.id())) {
            return Optional.empty();
        }
        Optional<SchemaColumn> pk = primaryKey(target);
        if (pk.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Match(target, pk.get(), confidence, false));
    }

    private Optional<SchemaColumn> primaryKey(SchemaTable table) {
        for (SchemaColumn c : columnsByTable.getOrDefault(table.id(), List.of())) {
            if (c.primaryKey()) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    private Optional<SchemaColumn> column(SchemaTable table, String columnName) {
        for (SchemaColumn c : columnsByTable.getOrDefault(table.id(), List.of())) {
            if (c.columnName().equalsIgnoreCase(columnName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * @param fromMetadata true when the pair came from a declared foreign key
     */
    public record Match(SchemaTable targetTable, SchemaColumn targetColumn, double confidence, boolean fromMetadata) {
    }
}
