package dev.pekelund.invoice.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One schema level after reconciliation: the values bound to declared fields and the
 * overflow entries collected for keys the level does not declare. Nested record fields
 * hold {@link ReconciledLevel} values (or lists of them). The typed accessors perform
 * the final scalar coercion and report failures against this level's path.
 *
 * @param path     dotted path of the level, empty for the document root
 * @param fields   declared field values keyed by wire name
 * @param overflow undeclared entries, in input order
 */
public record ReconciledLevel(String path, Map<String, Object> fields, Map<String, Object> overflow) {

    public ReconciledLevel {
        path = path != null ? path : FieldPaths.ROOT;
        fields = copyOf(fields);
        overflow = copyOf(overflow);
    }

    public String text(String name) {
        return ScalarCoercion.toText(FieldPaths.child(path, name), fields.get(name));
    }

    public BigDecimal decimal(String name) {
        return ScalarCoercion.toDecimal(FieldPaths.child(path, name), fields.get(name));
    }

    public FlexibleContent flexible(String name) {
        return ScalarCoercion.toFlexible(FieldPaths.child(path, name), fields.get(name));
    }

    public ReconciledLevel child(String name) {
        Object value = fields.get(name);
        if (value == null || value instanceof ReconciledLevel) {
            return (ReconciledLevel) value;
        }
        throw new IllegalStateException("Field '" + FieldPaths.child(path, name) + "' is not a reconciled record");
    }

    public ReconciledLevel requiredChild(String name) {
        ReconciledLevel child = child(name);
        if (child == null) {
            throw new IllegalStateException("Record field '" + FieldPaths.child(path, name) + "' was not reconciled");
        }
        return child;
    }

    public List<ReconciledLevel> children(String name) {
        List<ReconciledLevel> children = new ArrayList<>();
        for (Object element : sequence(name)) {
            if (!(element instanceof ReconciledLevel level)) {
                throw new IllegalStateException("Field '" + FieldPaths.child(path, name)
                    + "' does not hold reconciled records");
            }
            children.add(level);
        }
        return children;
    }

    public List<Object> sequence(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        throw new IllegalStateException("Field '" + FieldPaths.child(path, name) + "' is not a sequence");
    }

    public Map<String, Object> map(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
            return Collections.unmodifiableMap(copy);
        }
        throw new IllegalStateException("Field '" + FieldPaths.child(path, name) + "' is not an object");
    }

    /**
     * Returns a copy of this level whose overflow also holds the given entries. Entries
     * already present are kept as they are.
     */
    public ReconciledLevel withOverflow(Map<String, Object> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(overflow);
        additional.forEach(merged::putIfAbsent);
        return new ReconciledLevel(path, fields, merged);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
