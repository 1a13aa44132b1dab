package io.ontomesh.task;

import io.ontomesh.schema.ColumnStats;
import io.ontomesh.schema.SchemaDiscoverer;
import io.ontomesh.util.Hashing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the gathered-data map stored on a column entity after a scan.
 */
final class ColumnSampler {
    static final String ROW_COUNT = "row_count";
    static final String NON_NULL_COUNT = "non_null_count";
    static final String DISTINCT_COUNT = "distinct_count";
    static final String NULL_PERCENT = "null_percent";
    static final String SAMPLE_VALUES = "sample_values";
    static final String ENUM_CANDIDATE = "is_enum_candidate";
    static final String VALUE_FINGERPRINT = "value_fingerprint";
    static final String SCANNED_AT = "scanned_at";

    private static final int ENUM_DISTINCT_LIMIT = 50;
    private static final double ENUM_DISTINCT_RATIO = 0.1d;

    private ColumnSampler() {
    }

    static Map<String, Object> gather(
            SchemaDiscoverer discoverer,
            String schemaName,
            String tableName,
            ColumnStats stats,
            int sampleLimit
    ) throws Exception {
        List<String> samples = discoverer.distinctValues(schemaName, tableName, stats.columnName(), sampleLimit);
        return gathered(stats, samples, sampleLimit);
    }

    static Map<String, Object> gathered(ColumnStats stats, List<String> samples, int sampleLimit) {
        List<String> kept = samples.size() > sampleLimit ? samples.subList(0, sampleLimit) : samples;
        long rows = stats.rowCount();
        long distinct = stats.distinctCount();
        double nullPercent = rows <= 0L ? 0.0d : ((double) (rows - stats.nonNullCount()) * 100.0d) / rows;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(ROW_COUNT, rows);
        out.put(NON_NULL_COUNT, stats.nonNullCount());
        out.put(DISTINCT_COUNT, distinct);
        out.put(NULL_PERCENT, nullPercent);
        out.put(SAMPLE_VALUES, new ArrayList<>(kept));
        out.put(ENUM_CANDIDATE, isEnumCandidate(distinct, rows));
        out.put(VALUE_FINGERPRINT, fingerprint(kept));
        out.put(SCANNED_AT, Instant.now().toString());
        return out;
    }

    static boolean isEnumCandidate(long distinct, long rows) {
        return distinct > 0L && distinct <= ENUM_DISTINCT_LIMIT && distinct < rows * ENUM_DISTINCT_RATIO;
    }

    /**
     * First 8 bytes of SHA-256 over the sorted samples, hex encoded.
     */
    static String fingerprint(List<String> samples) {
        List<String> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        byte[] digest = Hashing.sha256(String.join("|", sorted));
        return HexFormat.of().formatHex(Arrays.copyOf(digest, 8));
    }

    static List<String> samples(Map<String, Object> gathered) {
        Object raw = gathered.get(SAMPLE_VALUES);
        if (!(raw instanceof List)) {
            return List.of();
        }
        List<?> list = (List<?>) raw;
        List<String> out = new ArrayList<>(list.size());
        for (Object v : list) {
            if (v != null) {
                out.add(String.valueOf(v));
            }
        }
        return out;
    }

    static long longValue(Map<String, Object> gathered, String key) {
        Object raw = gathered.get(key);
        return raw instanceof Number ? ((Number) raw).longValue() : 0L;
    }
}
