package io.ontomesh.workflow;

import io.ontomesh.queue.TaskSnapshot;
import io.ontomesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class TaskQueueWriterRegistry {
    private static final Logger log = LoggerFactory.getLogger(TaskQueueWriterRegistry.class);

    private final WorkflowStore workflows;
    private final int capacity;
    private final long stopWaitMs;
    private final ConcurrentMap<String, TaskQueueWriter> writers = new ConcurrentHashMap<>();

    public TaskQueueWriterRegistry(WorkflowStore workflows, int capacity, long stopWaitMs) {
        this.workflows = workflows;
        this.capacity = capacity;
        this.stopWaitMs = stopWaitMs;
    }

    public TaskQueueWriter start(String workflowId) {
        stop(workflowId);
        TaskQueueWriter writer = new TaskQueueWriter(workflowId, workflows, capacity);
        writers.put(workflowId, writer);
        writer.start();
        return writer;
    }

    public void offer(String workflowId, List<TaskSnapshot> snapshot) {
        TaskQueueWriter writer = writers.get(workflowId);
        if (writer != null) {
            writer.offer(snapshot);
        }
    }

    public void stop(String workflowId) {
        TaskQueueWriter writer = writers.remove(workflowId);
        if (writer != null && !writer.stop(stopWaitMs)) {
            log.warn("Task queue writer for workflow {} did not stop within {} ms", workflowId, stopWaitMs);
        }
    }

    public boolean isRunning(String workflowId) {
        return writers.containsKey(workflowId);
    }

    public List<String> workflowIds() {
        return new ArrayList<>(writers.keySet());
    }

    public void stopAll() {
        for (String id : workflowIds()) {
            stop(id);
        }
    }
}
