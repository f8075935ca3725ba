package dev.pekelund.invoice.parser.pdf;

/**
 * Signals that a PDF document could not be turned into a page image.
 */
public class PdfRenderingException extends RuntimeException {

    public PdfRenderingException(String message) {
        super(message);
    }

    public PdfRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
