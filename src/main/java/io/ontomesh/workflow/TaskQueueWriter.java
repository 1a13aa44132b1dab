package io.ontomesh.workflow;

import io.ontomesh.queue.TaskSnapshot;
import io.ontomesh.storage.WorkflowStore;
import io.ontomesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Persists queue snapshots for one workflow off the task threads. Only the newest buffered
 * snapshot is written per drain, and offers never block: a full buffer drops its oldest entry.
 */
public final class TaskQueueWriter {
    private static final Logger log = LoggerFactory.getLogger(TaskQueueWriter.class);
    private static final long POLL_MS = 50L;

    private final String workflowId;
    private final WorkflowStore workflows;
    private final BlockingQueue<List<TaskSnapshot>> buffer;
    private final Thread thread;
    private volatile boolean running = true;

    TaskQueueWriter(String workflowId, WorkflowStore workflows, int capacity) {
        this.workflowId = workflowId;
        this.workflows = workflows;
        this.buffer = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.thread = new Thread(this::loop, "ontomesh-queue-writer-" + workflowId);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    public void offer(List<TaskSnapshot> snapshot) {
        if (!running) {
            return;
        }
        while (!buffer.offer(snapshot)) {
            buffer.poll();
        }
    }

    /**
     * Stops accepting snapshots, flushes what is buffered and waits up to {@code waitMs}.
     *
     * @return true when the writer thread exited in time
     */
    boolean stop(long waitMs) {
        running = false;
        try {
            thread.join(Math.max(1L, waitMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private void loop() {
        while (running || !buffer.isEmpty()) {
            List<TaskSnapshot> latest;
            try {
                latest = buffer.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (latest == null) {
                continue;
            }
            List<List<TaskSnapshot>> drained = new ArrayList<>();
            buffer.drainTo(drained);
            if (!drained.isEmpty()) {
                latest = drained.get(drained.size() - 1);
            }
            try {
                workflows.updateTaskQueue(workflowId, Jsons.toCompactJson(latest));
            } catch (RuntimeException e) {
                log.warn("Failed to persist task queue for workflow {}: {}", workflowId, e.getMessage());
            }
        }
    }
}
