package dev.pekelund.invoice;

/**
 * Signals that an invoice reply could not be reconciled into a validated record.
 * Every failure names the dotted field path it occurred at ({@code ""} for the
 * document root) and the raw value that could not be accepted.
 */
public class InvoiceReconciliationException extends RuntimeException {

    private final String path;
    private final transient Object rawValue;

    public InvoiceReconciliationException(String message, String path, Object rawValue) {
        super(message);
        this.path = path != null ? path : "";
        this.rawValue = rawValue;
    }

    public InvoiceReconciliationException(String message, String path, Object rawValue, Throwable cause) {
        super(message, cause);
        this.path = path != null ? path : "";
        this.rawValue = rawValue;
    }

    public String getPath() {
        return path;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
