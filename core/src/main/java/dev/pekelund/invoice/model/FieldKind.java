package dev.pekelund.invoice.model;

/**
 * Structural kind of a declared schema field. The kind decides how the reconciler treats
 * the incoming value's shape and how the record model coerces it.
 */
public enum FieldKind {

    /** Optional scalar read as text. */
    TEXT,

    /** Optional scalar read as a decimal number. */
    DECIMAL,

    /** Nested record, always present; an absent value reconciles as an empty level. */
    RECORD,

    /** Nested record that is absent when the input omits it or supplies nothing. */
    OPTIONAL_RECORD,

    /** Ordered sequence of nested records. */
    RECORD_LIST,

    /** Ordered sequence of values whose structure the schema does not constrain. */
    SEQUENCE,

    /** Either text or a free-form object. */
    FLEXIBLE,

    /** Free-form object. */
    MAP
}
