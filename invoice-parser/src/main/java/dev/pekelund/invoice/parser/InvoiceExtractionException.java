package dev.pekelund.invoice.parser;

/**
 * Signals that the vision model could not produce a reply for an invoice document.
 */
public class InvoiceExtractionException extends RuntimeException {

    public InvoiceExtractionException(String message) {
        super(message);
    }

    public InvoiceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
