package io.ontomesh.queue;

/**
 * Marks a transient task failure. The queue retries tasks failing with this exception
 * anywhere in their cause chain; every other failure is final.
 */
public class RetryableTaskException extends Exception {
    public RetryableTaskException(String message) {
        super(message);
    }

    public RetryableTaskException(String message, Throwable cause) {
        super(message, cause);
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RetryableTaskException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
