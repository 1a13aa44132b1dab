package io.ontomesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class OntoMeshConfig {
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 90_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 2_000L;
    public static final long DEFAULT_STOP_WAIT_MS = 5_000L;
    public static final int DEFAULT_QUEUE_CONCURRENCY = 4;
    public static final int DEFAULT_LLM_PARALLEL_LIMIT = 1;
    public static final int DEFAULT_SAMPLE_LIMIT = 50;
    public static final int DEFAULT_OVERLAP_SAMPLE_SIZE = 1_000;
    public static final int DEFAULT_MAX_RETRIES = 24;
    public static final long DEFAULT_INITIAL_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0d;
    public static final double DEFAULT_BACKOFF_JITTER = 0.10d;
    public static final int DEFAULT_WRITER_BUFFER = 100;

    private final Path rootDir;

    public OntoMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static OntoMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new OntoMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("ontomesh.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path auditSigningKey() {
        return auditRoot().resolve("audit-signing.key");
    }

    public Path ontologyRoot() {
        return rootDir.resolve("ontology");
    }

    public Path settingsFile() {
        return rootDir.resolve("ontomesh-settings.json");
    }

    public EngineSettings loadSettings() {
        return EngineSettings.load(settingsFile());
    }
}
