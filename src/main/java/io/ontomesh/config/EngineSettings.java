package io.ontomesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.ontomesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for leasing, polling, queue concurrency and sampling. Values missing from the
 * settings file fall back to the {@link OntoMeshConfig} defaults.
 */
public record EngineSettings(
        long leaseTimeoutMs,
        long heartbeatIntervalMs,
        long pollIntervalMs,
        long stopWaitMs,
        int queueConcurrency,
        int llmParallelLimit,
        int sampleLimit,
        int overlapSampleSize,
        int maxRetries,
        long initialBackoffMs,
        long maxBackoffMs,
        double backoffFactor,
        double backoffJitter,
        int writerBuffer
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                OntoMeshConfig.DEFAULT_LEASE_TIMEOUT_MS,
                OntoMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                OntoMeshConfig.DEFAULT_POLL_INTERVAL_MS,
                OntoMeshConfig.DEFAULT_STOP_WAIT_MS,
                OntoMeshConfig.DEFAULT_QUEUE_CONCURRENCY,
                OntoMeshConfig.DEFAULT_LLM_PARALLEL_LIMIT,
                OntoMeshConfig.DEFAULT_SAMPLE_LIMIT,
                OntoMeshConfig.DEFAULT_OVERLAP_SAMPLE_SIZE,
                OntoMeshConfig.DEFAULT_MAX_RETRIES,
                OntoMeshConfig.DEFAULT_INITIAL_BACKOFF_MS,
                OntoMeshConfig.DEFAULT_MAX_BACKOFF_MS,
                OntoMeshConfig.DEFAULT_BACKOFF_FACTOR,
                OntoMeshConfig.DEFAULT_BACKOFF_JITTER,
                OntoMeshConfig.DEFAULT_WRITER_BUFFER
        );
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    public EngineSettings withPollIntervalMs(long value) {
        return new EngineSettings(leaseTimeoutMs, heartbeatIntervalMs, value, stopWaitMs, queueConcurrency,
                llmParallelLimit, sampleLimit, overlapSampleSize, maxRetries, initialBackoffMs, maxBackoffMs,
                backoffFactor, backoffJitter, writerBuffer);
    }

    public EngineSettings withHeartbeatIntervalMs(long value) {
        return new EngineSettings(leaseTimeoutMs, value, pollIntervalMs, stopWaitMs, queueConcurrency,
                llmParallelLimit, sampleLimit, overlapSampleSize, maxRetries, initialBackoffMs, maxBackoffMs,
                backoffFactor, backoffJitter, writerBuffer);
    }

    public EngineSettings withRetry(int retries, long initialMs, long maxMs) {
        return new EngineSettings(leaseTimeoutMs, heartbeatIntervalMs, pollIntervalMs, stopWaitMs, queueConcurrency,
                llmParallelLimit, sampleLimit, overlapSampleSize, retries, initialMs, maxMs,
                backoffFactor, backoffJitter, writerBuffer);
    }

    private static EngineSettings fromFile(SettingsFile file, EngineSettings d) {
        return new EngineSettings(
                positive(file.leaseTimeoutMs(), d.leaseTimeoutMs()),
                positive(file.heartbeatIntervalMs(), d.heartbeatIntervalMs()),
                positive(file.pollIntervalMs(), d.pollIntervalMs()),
                positive(file.stopWaitMs(), d.stopWaitMs()),
                positive(file.queueConcurrency(), d.queueConcurrency()),
                positive(file.llmParallelLimit(), d.llmParallelLimit()),
                positive(file.sampleLimit(), d.sampleLimit()),
                positive(file.overlapSampleSize(), d.overlapSampleSize()),
                file.maxRetries() == null || file.maxRetries() < 0 ? d.maxRetries() : file.maxRetries(),
                positive(file.initialBackoffMs(), d.initialBackoffMs()),
                positive(file.maxBackoffMs(), d.maxBackoffMs()),
                file.backoffFactor() == null || file.backoffFactor() < 1.0d ? d.backoffFactor() : file.backoffFactor(),
                file.backoffJitter() == null || file.backoffJitter() < 0.0d ? d.backoffJitter() : file.backoffJitter(),
                positive(file.writerBuffer(), d.writerBuffer())
        );
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(
            Long leaseTimeoutMs,
            Long heartbeatIntervalMs,
            Long pollIntervalMs,
            Long stopWaitMs,
            Integer queueConcurrency,
            Integer llmParallelLimit,
            Integer sampleLimit,
            Integer overlapSampleSize,
            Integer maxRetries,
            Long initialBackoffMs,
            Long maxBackoffMs,
            Double backoffFactor,
            Double backoffJitter,
            Integer writerBuffer
    ) {
    }
}
