package io.ontomesh.workflow;

import io.ontomesh.observability.AuditLogger;
import io.ontomesh.queue.RunContext;
import io.ontomesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One lease-renewal loop per driven workflow. A failed renewal means another server may
 * now own the workflow, so the driver context is cancelled and the loop stops itself.
 */
public final class HeartbeatRegistry {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatRegistry.class);
    static final String LEASE_LOST = "lease lost";

    private final WorkflowStore workflows;
    private final AuditLogger audit;
    private final long intervalMs;
    private final long stopWaitMs;
    private final ConcurrentMap<String, Heartbeat> running = new ConcurrentHashMap<>();

    public HeartbeatRegistry(WorkflowStore workflows, AuditLogger audit, long intervalMs, long stopWaitMs) {
        this.workflows = workflows;
        this.audit = audit;
        this.intervalMs = Math.max(1L, intervalMs);
        this.stopWaitMs = stopWaitMs;
    }

    public void start(String workflowId, String ownerId, RunContext driver) {
        stop(workflowId);
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ontomesh-heartbeat-" + workflowId);
            t.setDaemon(true);
            return t;
        });
        Heartbeat heartbeat = new Heartbeat(workflowId, ownerId, driver, executor);
        running.put(workflowId, heartbeat);
        executor.scheduleAtFixedRate(() -> beat(heartbeat), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("Started heartbeat for workflow {} (owner {}, every {} ms)", workflowId, ownerId, intervalMs);
    }

    /**
     * Stops renewal and waits a bounded time for the loop to exit. No entry remains afterwards.
     */
    public void stop(String workflowId) {
        Heartbeat heartbeat = running.remove(workflowId);
        if (heartbeat == null) {
            return;
        }
        heartbeat.executor.shutdownNow();
        try {
            if (!heartbeat.executor.awaitTermination(stopWaitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Heartbeat for workflow {} did not stop within {} ms", workflowId, stopWaitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning(String workflowId) {
        return running.containsKey(workflowId);
    }

    public List<String> workflowIds() {
        return new ArrayList<>(running.keySet());
    }

    public void stopAll() {
        for (String id : workflowIds()) {
            stop(id);
        }
    }

    void beat(Heartbeat heartbeat) {
        try {
            workflows.updateHeartbeat(heartbeat.workflowId, heartbeat.ownerId, Instant.now().toEpochMilli());
        } catch (RuntimeException e) {
            log.error("Heartbeat failed for workflow {}, stopping driver: {}", heartbeat.workflowId, e.getMessage());
            heartbeat.driver.cancel(LEASE_LOST);
            if (audit != null) {
                audit.log(AuditLogger.AuditEvent.of("lease.lost", heartbeat.ownerId, "workflow", "error",
                        heartbeat.workflowId, Map.of("reason", String.valueOf(e.getMessage()))));
            }
            running.remove(heartbeat.workflowId, heartbeat);
            heartbeat.executor.shutdown();
        }
    }

    static final class Heartbeat {
        private final String workflowId;
        private final String ownerId;
        private final RunContext driver;
        private final ScheduledExecutorService executor;

        private Heartbeat(String workflowId, String ownerId, RunContext driver, ScheduledExecutorService executor) {
            this.workflowId = workflowId;
            this.ownerId = ownerId;
            this.driver = driver;
            this.executor = executor;
        }
    }
}
