package io.ontomesh.workflow;

import io.ontomesh.config.OntoMeshConfig;
import io.ontomesh.model.Workflow;
import io.ontomesh.model.WorkflowPhase;
import io.ontomesh.model.WorkflowProgress;
import io.ontomesh.model.WorkflowState;
import io.ontomesh.queue.RunContext;
import io.ontomesh.storage.Database;
import io.ontomesh.storage.WorkflowStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class HeartbeatRegistryTest {
    @Test
    void heartbeatRenewsLeaseUntilStopped() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-heartbeat");
        try {
            WorkflowStore store = store(root);
            createClaimed(store, "wf_beat", "srv_a");
            HeartbeatRegistry registry = new HeartbeatRegistry(store, null, 20L, 1_000L);
            RunContext driver = RunContext.root();
            registry.start("wf_beat", "srv_a", driver);
            Assertions.assertTrue(registry.isRunning("wf_beat"));

            long deadline = System.currentTimeMillis() + 5_000L;
            while (store.get("wf_beat").orElseThrow().lastHeartbeatMs() <= 1_000L && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertTrue(store.get("wf_beat").orElseThrow().lastHeartbeatMs() > 1_000L);

            registry.stop("wf_beat");
            Assertions.assertFalse(registry.isRunning("wf_beat"));
            Assertions.assertTrue(registry.workflowIds().isEmpty());
            Assertions.assertFalse(driver.isCancelled());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lostLeaseCancelsDriver() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-heartbeat-lost");
        try {
            WorkflowStore store = store(root);
            createClaimed(store, "wf_taken", "srv_other");
            HeartbeatRegistry registry = new HeartbeatRegistry(store, null, 20L, 1_000L);
            RunContext driver = RunContext.root();
            registry.start("wf_taken", "srv_a", driver);

            long deadline = System.currentTimeMillis() + 5_000L;
            while (!driver.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertTrue(driver.isCancelled());
            Assertions.assertEquals(HeartbeatRegistry.LEASE_LOST, driver.reason());
            Assertions.assertEquals("srv_other", store.get("wf_taken").orElseThrow().ownerId());
            registry.stop("wf_taken");
            Assertions.assertFalse(registry.isRunning("wf_taken"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static WorkflowStore store(Path root) {
        Database db = new Database(OntoMeshConfig.fromRoot(root.toString()));
        db.init();
        return new WorkflowStore(db);
    }

    private static void createClaimed(WorkflowStore store, String id, String ownerId) {
        store.create(new Workflow(id, "proj_1", "ds_1", WorkflowPhase.TIER1_BUILDING, WorkflowState.RUNNING,
                WorkflowProgress.empty(WorkflowPhase.TIER1_BUILDING), null, 0L, null, 1L, 1L));
        Assertions.assertTrue(store.claimOwnership(id, ownerId, 1_000L, 60_000L));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
