package io.ontomesh.workflow;

import io.ontomesh.queue.QueueSettings;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkQueue;
import io.ontomesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Background machinery shared by both workflow services: the heartbeat and task-queue
 * writer registries plus the queues of workflows this process is currently driving.
 */
public final class WorkflowInfra {
    private static final Logger log = LoggerFactory.getLogger(WorkflowInfra.class);

    private final WorkflowStore workflows;
    private final HeartbeatRegistry heartbeats;
    private final TaskQueueWriterRegistry writers;
    private final ConcurrentMap<String, Driving> active = new ConcurrentHashMap<>();

    public WorkflowInfra(WorkflowStore workflows, HeartbeatRegistry heartbeats, TaskQueueWriterRegistry writers) {
        this.workflows = workflows;
        this.heartbeats = heartbeats;
        this.writers = writers;
    }

    public HeartbeatRegistry heartbeats() {
        return heartbeats;
    }

    public TaskQueueWriterRegistry writers() {
        return writers;
    }

    /**
     * Starts the heartbeat and writer for a claimed workflow and opens its queue.
     */
    public WorkQueue startDriving(String workflowId, String ownerId, RunContext driver, QueueSettings settings) {
        heartbeats.start(workflowId, ownerId, driver);
        writers.start(workflowId);
        WorkQueue queue = new WorkQueue(workflowId, settings, driver, snapshot -> writers.offer(workflowId, snapshot));
        Driving previous = active.put(workflowId, new Driving(queue, driver));
        if (previous != null) {
            previous.queue().close();
        }
        return queue;
    }

    public Optional<WorkQueue> queue(String workflowId) {
        return Optional.ofNullable(active.get(workflowId)).map(Driving::queue);
    }

    public boolean isDriving(String workflowId) {
        return active.containsKey(workflowId);
    }

    /**
     * Cancels the driver, closes the queue and stops background workers; optionally hands
     * the lease back.
     */
    public void stopDriving(String workflowId, boolean releaseOwnership) {
        Driving driving = active.remove(workflowId);
        if (driving != null) {
            driving.driver().cancel("workflow " + workflowId + " stopped");
            driving.queue().close();
        }
        writers.stop(workflowId);
        heartbeats.stop(workflowId);
        if (releaseOwnership) {
            try {
                workflows.releaseOwnership(workflowId);
            } catch (RuntimeException e) {
                log.warn("Failed to release ownership of workflow {}: {}", workflowId, e.getMessage());
            }
        }
    }

    /**
     * Cancels every active workflow of this process in parallel, bounded by {@code timeoutMs}.
     *
     * @return true when every workflow was released in time
     */
    public boolean shutdown(long timeoutMs) {
        Set<String> ids = new LinkedHashSet<>(active.keySet());
        ids.addAll(heartbeats.workflowIds());
        ids.addAll(writers.workflowIds());
        if (ids.isEmpty()) {
            return true;
        }
        log.info("Shutting down {} active workflow(s)", ids.size());
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(ids.size(), 8), r -> {
            Thread t = new Thread(r, "ontomesh-shutdown");
            t.setDaemon(true);
            return t;
        });
        for (String id : ids) {
            executor.execute(() -> stopDriving(id, true));
        }
        executor.shutdown();
        try {
            boolean done = executor.awaitTermination(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            if (!done) {
                log.warn("Workflow shutdown did not finish within {} ms", timeoutMs);
                executor.shutdownNow();
            }
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            return false;
        }
    }

    private record Driving(WorkQueue queue, RunContext driver) {
    }
}
