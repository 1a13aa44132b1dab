package io.ontomesh.storage;

import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import io.ontomesh.schema.DiscoveredSchema;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

final class SchemaStoreTest {

    @Test
    void reimportKeepsIdsOfSurvivingTablesAndColumns() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-schema-");
        try {
            SchemaStore store = new SchemaStore(WorkflowStoreTest.database(root));
            DiscoveredSchema first = new DiscoveredSchema(List.of(
                    new DiscoveredSchema.Table("main", "users", 3L, List.of(
                            new DiscoveredSchema.Column("id", "INTEGER", true, null, null, 0),
                            new DiscoveredSchema.Column("email", "TEXT", false, null, null, 1))),
                    new DiscoveredSchema.Table("main", "legacy", 0L, List.of(
                            new DiscoveredSchema.Column("id", "INTEGER", true, null, null, 0)))
            ));
            Assertions.assertEquals(2, store.replaceSchema("ds_1", first));
            Map<String, SchemaColumn> before = byName(store);

            DiscoveredSchema second = new DiscoveredSchema(List.of(
                    new DiscoveredSchema.Table("main", "users", 5L, List.of(
                            new DiscoveredSchema.Column("id", "INTEGER", true, null, null, 0),
                            new DiscoveredSchema.Column("name", "TEXT", false, null, null, 1))),
                    new DiscoveredSchema.Table("main", "orders", 9L, List.of(
                            new DiscoveredSchema.Column("user_id", "INTEGER", false, "users", "id", 0)))
            ));
            Assertions.assertEquals(2, store.replaceSchema("ds_1", second));
            Map<String, SchemaColumn> after = byName(store);

            Assertions.assertEquals(before.get("users.id").id(), after.get("users.id").id());
            Assertions.assertFalse(after.containsKey("users.email"));
            Assertions.assertFalse(after.containsKey("legacy.id"));
            Assertions.assertEquals("users", after.get("orders.user_id").fkTargetTable());

            List<SchemaTable> tables = store.listTablesByDatasource("ds_1");
            Assertions.assertEquals(List.of("orders", "users"), tables.stream().map(SchemaTable::tableName).toList());
            SchemaTable users = tables.get(1);
            Assertions.assertEquals(5L, users.rowCount());
            Assertions.assertEquals("main.users", users.qualifiedName());
            Assertions.assertEquals("users", store.getTable(after.get("users.id").tableId()).orElseThrow().tableName());
        } finally {
            WorkflowStoreTest.deleteRecursively(root);
        }
    }

    private static Map<String, SchemaColumn> byName(SchemaStore store) {
        Map<String, SchemaTable> tables = store.listTablesByDatasource("ds_1").stream()
                .collect(Collectors.toMap(SchemaTable::id, Function.identity()));
        return store.listColumnsByDatasource("ds_1").stream()
                .collect(Collectors.toMap(c -> tables.get(c.tableId()).tableName() + "." + c.columnName(), Function.identity()));
    }
}
