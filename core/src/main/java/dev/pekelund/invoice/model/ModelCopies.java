package dev.pekelund.invoice.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copies that, unlike {@link List#copyOf} and {@link Map#copyOf}, keep null
 * elements and values and preserve insertion order.
 */
final class ModelCopies {

    private ModelCopies() {
    }

    static Map<String, Object> map(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static <T> List<T> list(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }
}
