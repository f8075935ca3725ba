package dev.pekelund.invoice.parser;

/**
 * Raised when an extraction request carries a document the service cannot accept.
 */
public class InvalidInvoiceRequestException extends RuntimeException {

    public InvalidInvoiceRequestException(String message) {
        super(message);
    }

    public InvalidInvoiceRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
