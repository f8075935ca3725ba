package dev.pekelund.invoice.reconcile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites the text values {@code "null"} and {@code "NA"} to a real {@code null} at every
 * depth of a decoded tree. Keys are never touched and map entries are kept, so a key whose
 * value was a synonym stays present with a {@code null} value.
 */
public class NullSynonymNormalizer {

    private static final Set<String> NULL_SYNONYMS = Set.of("null", "NA");

    /**
     * @return a new tree; the input is not modified
     */
    public Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((key, entry) -> normalized.put(String.valueOf(key), normalize(entry)));
            return normalized;
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object element : list) {
                normalized.add(normalize(element));
            }
            return normalized;
        }
        if (value instanceof String text && NULL_SYNONYMS.contains(text)) {
            return null;
        }
        return value;
    }
}
