package io.ontomesh.task;

import io.ontomesh.model.EntityStatus;
import io.ontomesh.queue.RetryableTaskException;
import io.ontomesh.queue.RunContext;
import io.ontomesh.queue.WorkTask;
import io.ontomesh.queue.WorkflowCancelledException;
import io.ontomesh.storage.EntityStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A queued unit of work bound to one entity state row.
 *
 * <p>A task records its own outcome: a transient failure bumps the retry count and is
 * rethrown for the queue to retry; any other failure marks the entity {@code failed}
 * with the error before it is rethrown. Cancellation leaves the entity untouched.
 */
public abstract class EntityTask implements WorkTask {
    private static final Logger log = LoggerFactory.getLogger(EntityTask.class);

    protected final EntityStateStore states;
    protected final String stateId;
    private final int maxRetries;
    private int attempts;

    protected EntityTask(EntityStateStore states, String stateId, int maxRetries) {
        this.states = states;
        this.stateId = stateId;
        this.maxRetries = maxRetries;
    }

    @Override
    public String id() {
        return stateId;
    }

    @Override
    public final void execute(RunContext context) throws Exception {
        context.throwIfCancelled();
        attempts++;
        try {
            run(context);
        } catch (WorkflowCancelledException e) {
            throw e;
        } catch (Exception e) {
            if (context.isCancelled()) {
                throw e;
            }
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (RetryableTaskException.isRetryable(e) && attempts <= maxRetries) {
                states.incrementRetry(stateId, message);
                throw e;
            }
            recordFailure(message, e);
            throw e;
        }
    }

    protected abstract void run(RunContext context) throws Exception;

    /**
     * Called after the entity itself is marked failed; dependants may need failing too.
     */
    protected void onFailure(String message) {
    }

    private void recordFailure(String message, Exception cause) {
        try {
            states.updateStatus(stateId, EntityStatus.FAILED, message);
            onFailure(message);
        } catch (RuntimeException e) {
            log.warn("Failed to record failure for {} ({}): {}", name(), stateId, e.getMessage());
            cause.addSuppressed(e);
        }
    }
}
