package io.ontomesh.task;

import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

final class ForeignKeyHeuristicsTest {
    private final SchemaTable users = new SchemaTable("t_users", "ds", "main", "users", 10L);
    private final SchemaTable orders = new SchemaTable("t_orders", "ds", "main", "orders", 100L);
    private final SchemaTable categories = new SchemaTable("t_categories", "ds", "main", "categories", 5L);
    private final SchemaTable logs = new SchemaTable("t_logs", "ds", "main", "logs", 5L);

    private final SchemaColumn usersId = new SchemaColumn("c_users_id", "t_users", "id", "integer", true, null, null, 0);
    private final SchemaColumn ordersId = new SchemaColumn("c_orders_id", "t_orders", "id", "integer", true, null, null, 0);
    private final SchemaColumn ordersUserId = new SchemaColumn("c_orders_user_id", "t_orders", "user_id", "integer", false, null, null, 1);
    private final SchemaColumn ordersCategory = new SchemaColumn("c_orders_category", "t_orders", "category", "integer", false, null, null, 2);
    private final SchemaColumn ordersBuyer = new SchemaColumn("c_orders_buyer", "t_orders", "buyer", "integer", false, "main.users", null, 3);
    private final SchemaColumn ordersLogId = new SchemaColumn("c_orders_log_id", "t_orders", "log_id", "integer", false, null, null, 4);
    private final SchemaColumn categoriesId = new SchemaColumn("c_categories_id", "t_categories", "id", "integer", true, null, null, 0);
    private final SchemaColumn logsMessage = new SchemaColumn("c_logs_message", "t_logs", "message", "text", false, null, null, 0);

    private ForeignKeyHeuristics heuristics() {
        return new ForeignKeyHeuristics(
                List.of(users, orders, categories, logs),
                List.of(usersId, ordersId, ordersUserId, ordersCategory, ordersBuyer, ordersLogId, categoriesId, logsMessage));
    }

    @Test
    void idSuffixResolvesPluralTableName() {
        Optional<ForeignKeyHeuristics.Match> match = heuristics().detect(orders, ordersUserId);
        Assertions.assertTrue(match.isPresent());
        Assertions.assertEquals("users", match.get().targetTable().tableName());
        Assertions.assertEquals("c_users_id", match.get().targetColumn().id());
        Assertions.assertEquals(ForeignKeyHeuristics.ID_SUFFIX_CONFIDENCE, match.get().confidence(), 1e-9);
        Assertions.assertFalse(match.get().fromMetadata());
    }

    @Test
    void bareTableNameMatchesWithLowerConfidence() {
        Optional<ForeignKeyHeuristics.Match> match = heuristics().detect(orders, ordersCategory);
        Assertions.assertTrue(match.isPresent());
        Assertions.assertEquals("categories", match.get().targetTable().tableName());
        Assertions.assertEquals(ForeignKeyHeuristics.TABLE_NAME_CONFIDENCE, match.get().confidence(), 1e-9);
    }

    @Test
    void declaredForeignKeyWinsAndDefaultsToPrimaryKey() {
        Optional<ForeignKeyHeuristics.Match> match = heuristics().detect(orders, ordersBuyer);
        Assertions.assertTrue(match.isPresent());
        Assertions.assertTrue(match.get().fromMetadata());
        Assertions.assertEquals("c_users_id", match.get().targetColumn().id());
        Assertions.assertEquals(ForeignKeyHeuristics.METADATA_CONFIDENCE, match.get().confidence(), 1e-9);
    }

    @Test
    void primaryKeysAndTablesWithoutKeyAreSkipped() {
        Assertions.assertTrue(heuristics().detect(orders, ordersId).isEmpty());
        Assertions.assertTrue(heuristics().detect(orders, ordersLogId).isEmpty(), "logs has no primary key");
    }
}
