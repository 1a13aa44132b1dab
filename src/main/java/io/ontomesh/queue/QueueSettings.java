package io.ontomesh.queue;

import io.ontomesh.config.EngineSettings;

public record QueueSettings(
        int concurrency,
        int llmParallelLimit,
        int maxRetries,
        long initialBackoffMs,
        long maxBackoffMs,
        double backoffFactor,
        double backoffJitter
) {
    public QueueSettings {
        concurrency = Math.max(1, concurrency);
        llmParallelLimit = Math.max(1, llmParallelLimit);
        maxRetries = Math.max(0, maxRetries);
        initialBackoffMs = Math.max(0L, initialBackoffMs);
        maxBackoffMs = Math.max(initialBackoffMs, maxBackoffMs);
        backoffFactor = Math.max(1.0d, backoffFactor);
        backoffJitter = Math.max(0.0d, backoffJitter);
    }

    public static QueueSettings from(EngineSettings settings) {
        return new QueueSettings(
                settings.queueConcurrency(),
                settings.llmParallelLimit(),
                settings.maxRetries(),
                settings.initialBackoffMs(),
                settings.maxBackoffMs(),
                settings.backoffFactor(),
                settings.backoffJitter()
        );
    }

    /**
     * Exponential backoff before retry number {@code retry} (1-based), capped and jittered.
     */
    public long backoffMs(int retry, double unitRandom) {
        double backoff = initialBackoffMs;
        for (int i = 1; i < retry; i++) {
            backoff *= backoffFactor;
            if (backoff >= maxBackoffMs) {
                backoff = maxBackoffMs;
                break;
            }
        }
        backoff = Math.min(backoff, maxBackoffMs);
        double jitter = backoff * backoffJitter * ((unitRandom * 2.0d) - 1.0d);
        return Math.max(0L, Math.round(backoff + jitter));
    }
}
