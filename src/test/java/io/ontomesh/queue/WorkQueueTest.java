package io.ontomesh.queue;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkQueueTest {

    private static QueueSettings settings(int concurrency, int maxRetries) {
        return new QueueSettings(concurrency, 1, maxRetries, 1L, 5L, 2.0d, 0.0d);
    }

    @Test
    void siblingsStillFinishAfterOneTaskFails() {
        WorkQueue queue = new WorkQueue("siblings", settings(2, 0), RunContext.root(), null);
        try {
            AtomicInteger done = new AtomicInteger();
            queue.enqueue(task("boom", ctx -> {
                throw new IllegalStateException("broken table");
            }));
            for (int i = 0; i < 5; i++) {
                queue.enqueue(task("ok-" + i, ctx -> done.incrementAndGet()));
            }
            Optional<TaskFailure> failure = queue.await(RunContext.root());
            Assertions.assertTrue(failure.isPresent());
            Assertions.assertEquals("boom", failure.get().taskName());
            Assertions.assertEquals("broken table", failure.get().message());
            Assertions.assertEquals(5, done.get());
            Assertions.assertEquals(1, queue.progress().failed());
            Assertions.assertEquals(5, queue.progress().completed());

            Assertions.assertTrue(queue.await(RunContext.root()).isEmpty(), "failure is reported once");
        } finally {
            queue.close();
        }
    }

    @Test
    void retryableFailuresAreRetriedUntilSuccess() {
        WorkQueue queue = new WorkQueue("retry", settings(1, 3), RunContext.root(), null);
        try {
            AtomicInteger attempts = new AtomicInteger();
            queue.enqueue(task("flaky", ctx -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new RetryableTaskException("connection reset");
                }
            }));
            Assertions.assertTrue(queue.await(RunContext.root()).isEmpty());
            Assertions.assertEquals(3, attempts.get());
            Assertions.assertEquals(3, queue.snapshot().get(0).attempts());
        } finally {
            queue.close();
        }
    }

    @Test
    void nonRetryableFailureIsFinalOnFirstAttempt() {
        WorkQueue queue = new WorkQueue("final", settings(1, 5), RunContext.root(), null);
        try {
            AtomicInteger attempts = new AtomicInteger();
            queue.enqueue(task("bad", ctx -> {
                attempts.incrementAndGet();
                throw new IllegalArgumentException("bad column");
            }));
            Assertions.assertTrue(queue.await(RunContext.root()).isPresent());
            Assertions.assertEquals(1, attempts.get());
        } finally {
            queue.close();
        }
    }

    @Test
    void cancelledWaiterCancelsQueuedWork() throws Exception {
        WorkQueue queue = new WorkQueue("cancel", settings(1, 0), RunContext.root(), null);
        try {
            CountDownLatch started = new CountDownLatch(1);
            queue.enqueue(task("blocker", ctx -> {
                started.countDown();
                while (!ctx.isCancelled()) {
                    ctx.sleep(10L);
                }
            }));
            queue.enqueue(task("never", ctx -> Assertions.fail("should not run")));
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));

            RunContext waiter = RunContext.root();
            waiter.cancel("user");
            WorkflowCancelledException e = Assertions.assertThrows(WorkflowCancelledException.class,
                    () -> queue.await(waiter));
            Assertions.assertTrue(e.getMessage().contains("user"));
            Assertions.assertTrue(queue.context().isCancelled());
            Assertions.assertTrue(queue.snapshot().stream()
                    .anyMatch(s -> "never".equals(s.name()) && QueuedTaskStatus.CANCELLED.wire().equals(s.status())));
        } finally {
            queue.close();
        }
    }

    @Test
    void pausedQueueHoldsTasksUntilResumed() throws Exception {
        WorkQueue queue = new WorkQueue("pause", settings(1, 0), RunContext.root(), null);
        try {
            List<String> ran = new CopyOnWriteArrayList<>();
            queue.pause();
            queue.enqueue(task("held", ctx -> ran.add("held")));
            Thread.sleep(200L);
            Assertions.assertTrue(ran.isEmpty());
            Assertions.assertTrue(queue.isPaused());
            Assertions.assertEquals(1, queue.progress().paused());

            queue.resume();
            Assertions.assertTrue(queue.await(RunContext.root()).isEmpty());
            Assertions.assertEquals(List.of("held"), ran);
        } finally {
            queue.close();
        }
    }

    @Test
    void updatesArePublishedToListener() throws Exception {
        List<List<TaskSnapshot>> updates = new CopyOnWriteArrayList<>();
        WorkQueue queue = new WorkQueue("publish", settings(1, 0), RunContext.root(), updates::add);
        try {
            queue.enqueue(task("one", ctx -> {
            }));
            queue.await(RunContext.root());
            long deadline = System.currentTimeMillis() + 2_000L;
            boolean sawCompleted = false;
            while (!sawCompleted && System.currentTimeMillis() < deadline) {
                sawCompleted = updates.stream().anyMatch(u ->
                        !u.isEmpty() && QueuedTaskStatus.COMPLETED.wire().equals(u.get(0).status()));
                Thread.sleep(10L);
            }
            Assertions.assertTrue(sawCompleted);
        } finally {
            queue.close();
        }
    }

    @Test
    void backoffGrowsAndIsCapped() {
        QueueSettings s = new QueueSettings(1, 1, 5, 100L, 250L, 2.0d, 0.0d);
        Assertions.assertEquals(100L, s.backoffMs(1, 0.5d));
        Assertions.assertEquals(200L, s.backoffMs(2, 0.5d));
        Assertions.assertEquals(250L, s.backoffMs(3, 0.5d));
        Assertions.assertEquals(250L, s.backoffMs(10, 0.5d));
    }

    private static WorkTask task(String name, Body body) {
        return new WorkTask() {
            @Override
            public String id() {
                return name;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public void execute(RunContext context) throws Exception {
                body.run(context);
            }
        };
    }

    @FunctionalInterface
    private interface Body {
        void run(RunContext context) throws Exception;
    }
}
