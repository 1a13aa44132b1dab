package io.ontomesh.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded concurrent executor for workflow tasks.
 *
 * <p>A failing task never stops its siblings: {@link #await(RunContext)} drains every task
 * enqueued so far and reports only the first failure seen since the previous await. Tasks
 * flagged as LLM work additionally share a small permit pool so reasoning calls can be
 * serialized or throttled independently of data tasks.
 */
public final class WorkQueue {
    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);
    private static final long AWAIT_POLL_MS = 100L;

    private final String name;
    private final QueueSettings settings;
    private final RunContext context;
    private final Consumer<List<TaskSnapshot>> onUpdate;
    private final ExecutorService executor;
    private final Semaphore llmPermits;
    private final Object lock = new Object();
    private final Map<String, Tracked> tasks = new LinkedHashMap<>();
    private int outstanding;
    private TaskFailure firstFailure;
    private boolean paused;
    private boolean closed;

    public WorkQueue(String name, QueueSettings settings, RunContext parent, Consumer<List<TaskSnapshot>> onUpdate) {
        this.name = name;
        this.settings = settings;
        this.context = parent == null ? RunContext.root() : parent.child();
        this.onUpdate = onUpdate;
        this.executor = Executors.newFixedThreadPool(settings.concurrency(), threadFactory(name));
        this.llmPermits = new Semaphore(settings.llmParallelLimit(), true);
    }

    public String name() {
        return name;
    }

    public RunContext context() {
        return context;
    }

    public void enqueue(WorkTask task) {
        Tracked tracked = new Tracked(task, Instant.now().toEpochMilli());
        boolean rejected;
        synchronized (lock) {
            tasks.put(tracked.id, tracked);
            rejected = closed || context.isCancelled();
            if (rejected) {
                tracked.status = QueuedTaskStatus.CANCELLED;
                tracked.finishedAtMs = tracked.enqueuedAtMs;
                tracked.done = true;
            } else {
                outstanding++;
            }
        }
        if (!rejected) {
            try {
                executor.execute(() -> run(tracked));
            } catch (RejectedExecutionException e) {
                finish(tracked, QueuedTaskStatus.CANCELLED, null);
            }
        }
        publish();
    }

    /**
     * Blocks until every task enqueued so far has finished.
     *
     * @return the first task failure observed since the previous call
     * @throws WorkflowCancelledException when {@code waiter} is cancelled while waiting;
     *                                    the queue is cancelled before the exception is thrown
     */
    public Optional<TaskFailure> await(RunContext waiter) {
        synchronized (lock) {
            while (outstanding > 0) {
                if (waiter != null && waiter.isCancelled()) {
                    break;
                }
                try {
                    lock.wait(AWAIT_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (waiter != null) {
                        waiter.cancel("interrupted");
                    }
                    break;
                }
            }
            if (outstanding == 0 || waiter == null || !waiter.isCancelled()) {
                TaskFailure out = firstFailure;
                firstFailure = null;
                return Optional.ofNullable(out);
            }
        }
        cancel();
        throw new WorkflowCancelledException(waiter.reason());
    }

    /**
     * Cancels tasks that have not started and signals running tasks through the queue context.
     */
    public void cancel() {
        context.cancel("queue " + name + " cancelled");
        long nowMs = Instant.now().toEpochMilli();
        synchronized (lock) {
            for (Tracked t : tasks.values()) {
                if (!t.done && (t.status == QueuedTaskStatus.PENDING || t.status == QueuedTaskStatus.PAUSED)) {
                    t.status = QueuedTaskStatus.CANCELLED;
                    t.finishedAtMs = nowMs;
                    t.done = true;
                    outstanding--;
                }
            }
            lock.notifyAll();
        }
        publish();
    }

    public void pause() {
        synchronized (lock) {
            paused = true;
        }
        publish();
    }

    public void resume() {
        synchronized (lock) {
            paused = false;
            lock.notifyAll();
        }
        publish();
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    public QueueProgress progress() {
        int pending = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        int pausedCount = 0;
        synchronized (lock) {
            for (Tracked t : tasks.values()) {
                switch (t.status) {
                    case PENDING -> pending++;
                    case RUNNING -> running++;
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case CANCELLED -> cancelled++;
                    case PAUSED -> pausedCount++;
                    default -> {
                    }
                }
            }
            return new QueueProgress(tasks.size(), pending, running, completed, failed, cancelled, pausedCount);
        }
    }

    public List<TaskSnapshot> snapshot() {
        synchronized (lock) {
            List<TaskSnapshot> out = new ArrayList<>(tasks.size());
            for (Tracked t : tasks.values()) {
                out.add(t.toSnapshot());
            }
            return out;
        }
    }

    /**
     * Cancels outstanding work and stops the worker threads.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
        }
        cancel();
        executor.shutdownNow();
    }

    /**
     * Waits for worker threads to exit after {@link #close()}.
     *
     * @return false when a task was still running at the deadline
     */
    public boolean awaitTermination(long timeoutMs) {
        try {
            return executor.awaitTermination(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void run(Tracked tracked) {
        if (!awaitStart(tracked)) {
            finish(tracked, QueuedTaskStatus.CANCELLED, null);
            return;
        }
        WorkTask task = tracked.task;
        int attempt = 0;
        while (true) {
            attempt++;
            if (!markRunning(tracked, attempt)) {
                return;
            }
            boolean llm = task.requiresLlm();
            long delayMs = 0L;
            try {
                if (llm) {
                    llmPermits.acquire();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finish(tracked, QueuedTaskStatus.CANCELLED, null);
                return;
            }
            try {
                task.execute(context);
                finish(tracked, QueuedTaskStatus.COMPLETED, null);
                return;
            } catch (Exception e) {
                if (context.isCancelled() || e instanceof WorkflowCancelledException) {
                    finish(tracked, QueuedTaskStatus.CANCELLED, e);
                    return;
                }
                if (!RetryableTaskException.isRetryable(e) || attempt > settings.maxRetries()) {
                    log.warn("Task {} ({}) failed after {} attempt(s): {}", task.name(), task.id(), attempt, e.getMessage());
                    finish(tracked, QueuedTaskStatus.FAILED, e);
                    return;
                }
                delayMs = settings.backoffMs(attempt, ThreadLocalRandom.current().nextDouble());
                log.info("Retrying task {} ({}) in {} ms after attempt {}: {}", task.name(), task.id(), delayMs, attempt, e.getMessage());
                markWaiting(tracked, e);
            } finally {
                if (llm) {
                    llmPermits.release();
                }
            }
            if (!context.sleep(delayMs)) {
                finish(tracked, QueuedTaskStatus.CANCELLED, null);
                return;
            }
        }
    }

    private boolean awaitStart(Tracked tracked) {
        boolean changed = false;
        synchronized (lock) {
            while (paused && !context.isCancelled() && !tracked.done) {
                if (tracked.status != QueuedTaskStatus.PAUSED) {
                    tracked.status = QueuedTaskStatus.PAUSED;
                    changed = true;
                }
                try {
                    lock.wait(AWAIT_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            if (tracked.status == QueuedTaskStatus.PAUSED) {
                tracked.status = QueuedTaskStatus.PENDING;
            }
        }
        if (changed) {
            publish();
        }
        return !tracked.done && !context.isCancelled();
    }

    private boolean markRunning(Tracked tracked, int attempt) {
        synchronized (lock) {
            if (tracked.done) {
                return false;
            }
            tracked.status = QueuedTaskStatus.RUNNING;
            tracked.attempts = attempt;
            if (tracked.startedAtMs == 0L) {
                tracked.startedAtMs = Instant.now().toEpochMilli();
            }
        }
        publish();
        return true;
    }

    private void markWaiting(Tracked tracked, Exception error) {
        synchronized (lock) {
            tracked.status = QueuedTaskStatus.PENDING;
            tracked.error = error.getMessage();
        }
        publish();
    }

    private void finish(Tracked tracked, QueuedTaskStatus status, Exception error) {
        synchronized (lock) {
            if (tracked.done) {
                return;
            }
            tracked.done = true;
            tracked.status = status;
            tracked.finishedAtMs = Instant.now().toEpochMilli();
            if (error != null) {
                tracked.error = error.getMessage();
            }
            if (status == QueuedTaskStatus.FAILED && firstFailure == null) {
                firstFailure = new TaskFailure(tracked.id, tracked.task.name(), error);
            }
            outstanding--;
            lock.notifyAll();
        }
        publish();
    }

    private void publish() {
        if (onUpdate == null) {
            return;
        }
        try {
            onUpdate.accept(snapshot());
        } catch (RuntimeException e) {
            log.warn("Queue {} update listener failed: {}", name, e.getMessage());
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ontomesh-queue-" + name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Tracked {
        private final String id;
        private final WorkTask task;
        private final long enqueuedAtMs;
        private QueuedTaskStatus status = QueuedTaskStatus.PENDING;
        private int attempts;
        private String error;
        private long startedAtMs;
        private long finishedAtMs;
        private boolean done;

        private Tracked(WorkTask task, long enqueuedAtMs) {
            this.id = task.id();
            this.task = task;
            this.enqueuedAtMs = enqueuedAtMs;
        }

        private TaskSnapshot toSnapshot() {
            return new TaskSnapshot(id, task.name(), status.wire(), task.requiresLlm(), attempts, error,
                    enqueuedAtMs, startedAtMs, finishedAtMs);
        }
    }
}
