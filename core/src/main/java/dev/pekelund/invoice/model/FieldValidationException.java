package dev.pekelund.invoice.model;

import dev.pekelund.invoice.InvoiceReconciliationException;

/**
 * Raised when a leaf value cannot be coerced to the scalar type its field declares.
 */
public class FieldValidationException extends InvoiceReconciliationException {

    private final String targetType;

    public FieldValidationException(String path, Object rawValue, String targetType) {
        super(String.format("Value at '%s' cannot be read as %s: %s", path, targetType, rawValue), path, rawValue);
        this.targetType = targetType;
    }

    public String getTargetType() {
        return targetType;
    }
}
