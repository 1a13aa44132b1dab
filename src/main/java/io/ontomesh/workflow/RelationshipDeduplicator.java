package io.ontomesh.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Keeps one relationship per ordered (source table, target table) pair. The entry with the
 * longer description wins; on equal length the first one seen stays.
 */
public final class RelationshipDeduplicator {
    private RelationshipDeduplicator() {
    }

    public static <T> List<T> byTablePair(
            List<T> items,
            Function<T, String> sourceTable,
            Function<T, String> targetTable,
            Function<T, String> description
    ) {
        Map<String, T> survivors = new LinkedHashMap<>();
        for (T item : items) {
            String key = sourceTable.apply(item) + "->" + targetTable.apply(item);
            T current = survivors.get(key);
            if (current == null || length(description.apply(item)) > length(description.apply(current))) {
                survivors.put(key, item);
            }
        }
        return new ArrayList<>(survivors.values());
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
