package dev.pekelund.invoice.model;

import java.util.Objects;

/**
 * A field declared at one schema level.
 *
 * @param name   wire name of the field
 * @param kind   structural kind of the field
 * @param schema child schema for record kinds, {@code null} otherwise
 */
public record FieldDefinition(String name, FieldKind kind, RecordSchema schema) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        boolean nested = kind == FieldKind.RECORD || kind == FieldKind.OPTIONAL_RECORD
            || kind == FieldKind.RECORD_LIST;
        if (nested && schema == null) {
            throw new IllegalArgumentException("Field '" + name + "' of kind " + kind + " requires a child schema");
        }
    }

    public static FieldDefinition text(String name) {
        return new FieldDefinition(name, FieldKind.TEXT, null);
    }

    public static FieldDefinition decimal(String name) {
        return new FieldDefinition(name, FieldKind.DECIMAL, null);
    }

    public static FieldDefinition record(String name, RecordSchema schema) {
        return new FieldDefinition(name, FieldKind.RECORD, schema);
    }

    public static FieldDefinition optionalRecord(String name, RecordSchema schema) {
        return new FieldDefinition(name, FieldKind.OPTIONAL_RECORD, schema);
    }

    public static FieldDefinition recordList(String name, RecordSchema schema) {
        return new FieldDefinition(name, FieldKind.RECORD_LIST, schema);
    }

    public static FieldDefinition sequence(String name) {
        return new FieldDefinition(name, FieldKind.SEQUENCE, null);
    }

    public static FieldDefinition flexible(String name) {
        return new FieldDefinition(name, FieldKind.FLEXIBLE, null);
    }

    public static FieldDefinition map(String name) {
        return new FieldDefinition(name, FieldKind.MAP, null);
    }
}
