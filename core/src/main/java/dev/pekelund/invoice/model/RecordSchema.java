package dev.pekelund.invoice.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The declared fields of one schema level, in declaration order.
 */
public final class RecordSchema {

    private final String name;
    private final Map<String, FieldDefinition> fields;

    private RecordSchema(String name, List<FieldDefinition> fields) {
        this.name = Objects.requireNonNull(name, "name");
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            if (byName.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in schema " + name);
            }
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public static RecordSchema of(String name, FieldDefinition... fields) {
        return new RecordSchema(name, List.of(fields));
    }

    public String name() {
        return name;
    }

    public Collection<FieldDefinition> fields() {
        return fields.values();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean declares(String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "RecordSchema{" + name + " " + fields.keySet() + '}';
    }
}
