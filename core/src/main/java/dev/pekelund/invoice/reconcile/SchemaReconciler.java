package dev.pekelund.invoice.reconcile;

import dev.pekelund.invoice.model.FieldDefinition;
import dev.pekelund.invoice.model.FieldPaths;
import dev.pekelund.invoice.model.InvoiceSchema;
import dev.pekelund.invoice.model.RecordSchema;
import dev.pekelund.invoice.model.ReconciledLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a decoded object onto one schema level and, recursively, onto every nested level.
 *
 * <p>Keys declared by the level are bound to their fields after shape checks and
 * sequence wrapping. Every other key is copied, by reference and without further
 * normalisation, into the level's overflow map. An incoming {@code extra_fields} object is
 * unwrapped into the overflow map when none of its keys clashes with a declared field or
 * an undeclared sibling; otherwise it is kept whole under its own key.
 *
 * <p>Instances hold no state and may be shared between threads.
 */
public class SchemaReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaReconciler.class);

    private static final String SCALAR = "scalar";
    private static final String OBJECT = "object";
    private static final String TEXT_OR_OBJECT = "string or object";

    public ReconciledLevel reconcile(Map<?, ?> input, RecordSchema schema, String path) {
        Map<?, ?> source = input != null ? input : Map.of();
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldDefinition field : schema.fields()) {
            String fieldPath = FieldPaths.child(path, field.name());
            fields.put(field.name(), reconcileField(field, source.get(field.name()), fieldPath));
        }
        Map<String, Object> overflow = collectOverflow(source, schema, path);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Reconciled level '{}' ({}) with overflow keys {}", displayPath(path), schema.name(),
                overflow.keySet());
        }
        return new ReconciledLevel(path, fields, overflow);
    }

    private Object reconcileField(FieldDefinition field, Object value, String path) {
        return switch (field.kind()) {
            case TEXT, DECIMAL -> requireScalar(value, path);
            case RECORD -> reconcileRecord(field.schema(), value, path, false);
            case OPTIONAL_RECORD -> reconcileRecord(field.schema(), value, path, true);
            case RECORD_LIST -> reconcileRecordList(field.schema(), value, path);
            case SEQUENCE -> asSequence(value);
            case FLEXIBLE -> requireScalarOrObject(value, path);
            case MAP -> reconcileMap(field, value, path);
        };
    }

    private Object requireScalar(Object value, String path) {
        if (value == null || ValueShape.of(value).isScalar()) {
            return value;
        }
        throw new SchemaMismatchException(path, SCALAR, value);
    }

    private Object requireScalarOrObject(Object value, String path) {
        if (value instanceof List<?>) {
            throw new SchemaMismatchException(path, TEXT_OR_OBJECT, value);
        }
        return value;
    }

    private ReconciledLevel reconcileRecord(RecordSchema schema, Object value, String path, boolean optional) {
        if (value == null) {
            return optional ? null : reconcile(Map.of(), schema, path);
        }
        if (value instanceof Map<?, ?> map) {
            if (optional && map.isEmpty()) {
                return null;
            }
            return reconcile(map, schema, path);
        }
        throw new SchemaMismatchException(path, OBJECT, value);
    }

    private List<ReconciledLevel> reconcileRecordList(RecordSchema schema, Object value, String path) {
        if (value == null) {
            return List.of();
        }
        List<?> elements = value instanceof List<?> list ? list : List.of(value);
        List<ReconciledLevel> levels = new ArrayList<>(elements.size());
        for (int index = 0; index < elements.size(); index++) {
            Object element = elements.get(index);
            String elementPath = FieldPaths.element(path, index);
            if (!(element instanceof Map<?, ?> map)) {
                throw new SchemaMismatchException(elementPath, OBJECT, element);
            }
            levels.add(reconcile(map, schema, elementPath));
        }
        return levels;
    }

    private List<Object> asSequence(Object value) {
        List<Object> sequence = new ArrayList<>();
        if (value instanceof List<?> list) {
            sequence.addAll(list);
        } else if (value != null) {
            sequence.add(value);
        }
        return sequence;
    }

    private Map<String, Object> copyObject(Object value, String path) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (value == null) {
            return copy;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new SchemaMismatchException(path, OBJECT, value);
        }
        map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }

    private Map<String, Object> reconcileMap(FieldDefinition field, Object value, String path) {
        Map<String, Object> copy = copyObject(value, path);
        if (InvoiceSchema.ADDITIONAL_METADATA.equals(field.name())
            && copy.get(InvoiceSchema.REFERENCE_NUMBERS) instanceof String referenceNumber) {
            copy.put(InvoiceSchema.REFERENCE_NUMBERS, List.of(referenceNumber));
        }
        return copy;
    }

    private Map<String, Object> collectOverflow(Map<?, ?> source, RecordSchema schema, String path) {
        Map<String, Object> undeclared = new LinkedHashMap<>();
        boolean hasExplicitOverflow = false;
        Object explicitOverflow = null;
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (InvoiceSchema.OVERFLOW_FIELD.equals(key)) {
                hasExplicitOverflow = true;
                explicitOverflow = entry.getValue();
            } else if (!schema.declares(key)) {
                undeclared.put(key, entry.getValue());
            }
        }
        if (!hasExplicitOverflow || explicitOverflow == null) {
            return undeclared;
        }

        Map<String, Object> overflow = new LinkedHashMap<>();
        if (explicitOverflow instanceof Map<?, ?> explicit && canUnwrap(explicit, schema, undeclared)) {
            explicit.forEach((key, value) -> overflow.put(String.valueOf(key), value));
            overflow.putAll(undeclared);
        } else {
            LOGGER.debug("Keeping '{}' at '{}' as a single overflow entry", InvoiceSchema.OVERFLOW_FIELD,
                displayPath(path));
            overflow.putAll(undeclared);
            overflow.put(InvoiceSchema.OVERFLOW_FIELD, explicitOverflow);
        }
        return overflow;
    }

    private boolean canUnwrap(Map<?, ?> explicit, RecordSchema schema, Map<String, Object> undeclared) {
        for (Object rawKey : explicit.keySet()) {
            String key = String.valueOf(rawKey);
            if (schema.declares(key) || undeclared.containsKey(key)) {
                return false;
            }
        }
        return true;
    }

    private static String displayPath(String path) {
        return path == null || path.isEmpty() ? "<root>" : path;
    }
}
