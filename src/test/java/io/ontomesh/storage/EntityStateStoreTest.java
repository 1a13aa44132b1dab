package io.ontomesh.storage;

import io.ontomesh.model.EntityState;
import io.ontomesh.model.EntityStatus;
import io.ontomesh.model.EntityType;
import io.ontomesh.model.WorkflowPhase;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class EntityStateStoreTest {

    @Test
    void statusMovesForwardAndRepeatsAreNoOps() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-entity-status-");
        try {
            Database db = WorkflowStoreTest.database(root);
            WorkflowStore workflows = new WorkflowStore(db);
            EntityStateStore states = new EntityStateStore(db);
            String wf = WorkflowStoreTest.createWorkflow(workflows, "proj", WorkflowPhase.TIER1_BUILDING, 1L);
            states.createBatch("proj", List.of(
                    entity("st_1", wf, EntityType.TABLE, "orders"),
                    entity("st_2", wf, EntityType.COLUMN, "orders.id")
            ));

            states.updateStatus("st_1", EntityStatus.SCANNING, null);
            states.updateStatus("st_1", EntityStatus.SCANNING, null);
            states.updateStatus("st_1", EntityStatus.SCANNED, null);
            IllegalStateException backward = Assertions.assertThrows(IllegalStateException.class,
                    () -> states.updateStatus("st_1", EntityStatus.PENDING, null));
            Assertions.assertTrue(backward.getMessage().contains("scanned -> pending"));

            states.updateStateData("st_1", EntityStatus.ANALYZING, Map.of("row_count", 42));
            EntityState table = states.getByEntity(wf, EntityType.TABLE, "orders").orElseThrow();
            Assertions.assertEquals(EntityStatus.ANALYZING, table.status());
            Assertions.assertEquals(42, ((Number) table.stateData().get("row_count")).intValue());

            states.updateStatus("st_1", EntityStatus.COMPLETE, null);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> states.updateStatus("st_1", EntityStatus.FAILED, "late failure"));

            states.incrementRetry("st_2", "timeout");
            states.incrementRetry("st_2", "timeout again");
            EntityState column = states.getByEntity(wf, EntityType.COLUMN, "orders.id").orElseThrow();
            Assertions.assertEquals(2, column.retryCount());
            Assertions.assertEquals("timeout again", column.lastError());
            Assertions.assertEquals(EntityStatus.PENDING, column.status());

            Assertions.assertThrows(IllegalStateException.class,
                    () -> states.updateStatus("missing", EntityStatus.SCANNING, null));
        } finally {
            WorkflowStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void projectCleanupOnlyTouchesTheGivenPhase() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-entity-cleanup-");
        try {
            Database db = WorkflowStoreTest.database(root);
            WorkflowStore workflows = new WorkflowStore(db);
            EntityStateStore states = new EntityStateStore(db);
            String extraction = WorkflowStoreTest.createWorkflow(workflows, "proj", WorkflowPhase.TIER1_BUILDING, 1L);
            String detection = WorkflowStoreTest.createWorkflow(workflows, "proj", WorkflowPhase.RELATIONSHIPS, 2L);
            states.createBatch("proj", List.of(
                    entity("st_a", extraction, EntityType.GLOBAL, ""),
                    entity("st_b", extraction, EntityType.TABLE, "orders"),
                    entity("st_c", detection, EntityType.COLUMN, "orders.user_id")
            ));

            Assertions.assertEquals(2, states.deleteByProject("proj", WorkflowPhase.TIER1_BUILDING));
            Assertions.assertTrue(states.listByWorkflow(extraction).isEmpty());
            Assertions.assertEquals(1, states.listByWorkflow(detection).size());
            Assertions.assertEquals(1, states.deleteByWorkflow(detection));
        } finally {
            WorkflowStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void concurrentWritersDoNotFailOnLockUpgrade() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-entity-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Database db = WorkflowStoreTest.database(root);
            EntityStateStore states = new EntityStateStore(db);
            String wf = WorkflowStoreTest.createWorkflow(new WorkflowStore(db), "proj", WorkflowPhase.TIER1_BUILDING, 1L);
            List<EntityState> rows = new ArrayList<>();
            for (int i = 0; i < 240; i++) {
                rows.add(entity("st_" + i, wf, EntityType.COLUMN, "t" + (i % 30) + ".c" + i));
            }
            states.createBatch("proj", rows);

            List<String> errors = new CopyOnWriteArrayList<>();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                int offset = worker;
                futures.add(pool.submit(() -> {
                    try {
                        start.await();
                        for (int i = offset; i < rows.size(); i += 8) {
                            String id = rows.get(i).id();
                            states.updateStatus(id, EntityStatus.SCANNING, null);
                            states.updateStatus(id, EntityStatus.SCANNED, null);
                            states.updateStateData(id, EntityStatus.ANALYZING, Map.of("worker", offset));
                            states.updateStatus(id, EntityStatus.COMPLETE, null);
                        }
                    } catch (Exception e) {
                        errors.add(String.valueOf(e.getMessage()));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }

            Assertions.assertEquals(List.of(), errors);
            Assertions.assertTrue(states.listByWorkflow(wf).stream().allMatch(s -> s.status() == EntityStatus.COMPLETE));
        } finally {
            pool.shutdownNow();
            WorkflowStoreTest.deleteRecursively(root);
        }
    }

    static EntityState entity(String id, String workflowId, EntityType type, String key) {
        return new EntityState(id, workflowId, type, key, EntityStatus.PENDING, 0, null, Map.of(), 1L, 1L);
    }
}
