package io.ontomesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ontomesh.util.Hashing;
import io.ontomesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of workflow lifecycle events. Each row carries the hash of the
 * previous row so truncation or edits are detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("workflow_id", event.workflowId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<Map<String, Object>> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<Map<String, Object>> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(Jsons.toMap(line));
        }
        return out;
    }

    public synchronized VerifyOutcome verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            Map<String, Object> row = Jsons.toMap(line);
            Object hash = row.remove("hash");
            Object signature = row.remove("signature");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                return new VerifyOutcome(false, checked, "prev_hash mismatch at row " + (checked + 1));
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(hash)) {
                return new VerifyOutcome(false, checked, "hash mismatch at row " + (checked + 1));
            }
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, recomputed).equals(signature)) {
                return new VerifyOutcome(false, checked, "signature mismatch at row " + (checked + 1));
            }
            expectedPrev = recomputed;
            checked++;
        }
        return new VerifyOutcome(true, checked, "ok");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String workflowId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String workflowId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, workflowId, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean ok, int checkedRows, String message) {
    }
}
