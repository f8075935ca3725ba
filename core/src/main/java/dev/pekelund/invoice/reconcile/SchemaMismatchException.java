package dev.pekelund.invoice.reconcile;

import dev.pekelund.invoice.InvoiceReconciliationException;

/**
 * Raised when a value's structure (object, sequence or scalar) cannot be reconciled with
 * the structure its schema field declares.
 */
public class SchemaMismatchException extends InvoiceReconciliationException {

    private final String expected;
    private final ValueShape actual;

    public SchemaMismatchException(String path, String expected, Object rawValue) {
        super(String.format("Expected %s at '%s' but found %s", expected, displayPath(path),
            ValueShape.of(rawValue).describe()), path, rawValue);
        this.expected = expected;
        this.actual = ValueShape.of(rawValue);
    }

    public String getExpected() {
        return expected;
    }

    public ValueShape getActual() {
        return actual;
    }

    private static String displayPath(String path) {
        return path == null || path.isEmpty() ? "<root>" : path;
    }
}
