package io.ontomesh.queue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token shared by a driver loop, its queue and its tasks.
 * Cancelling a context cancels every child created from it.
 */
public final class RunContext {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<RunContext> children = new CopyOnWriteArrayList<>();

    public static RunContext root() {
        return new RunContext();
    }

    public RunContext child() {
        RunContext child = new RunContext();
        children.add(child);
        String current = reason.get();
        if (current != null) {
            child.cancel(current);
        }
        return child;
    }

    public void cancel(String why) {
        String value = why == null || why.isBlank() ? "cancelled" : why;
        if (!reason.compareAndSet(null, value)) {
            return;
        }
        cancelled.countDown();
        for (RunContext child : children) {
            child.cancel(value);
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new WorkflowCancelledException(current);
        }
    }

    /**
     * Sleeps up to {@code millis}, returning early when cancelled.
     *
     * @return true when the full interval elapsed without cancellation
     */
    public boolean sleep(long millis) {
        if (millis <= 0L) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
    }
}
