package dev.pekelund.invoice.reconcile;

import dev.pekelund.invoice.InvoiceReconciliationException;

/**
 * Raised when the reply is not valid JSON even after repair. Carries the text as it was
 * received, the text that was handed to the parser and the parser's diagnostics.
 */
public class MalformedResponseException extends InvoiceReconciliationException {

    private final String repairedText;
    private final String reason;
    private final int line;
    private final int column;

    public MalformedResponseException(String rawText, String repairedText, String reason, int line, int column,
        Throwable cause) {
        super(String.format("Reply is not valid JSON (line %d, column %d): %s", line, column, reason), "", rawText,
            cause);
        this.repairedText = repairedText;
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public String getRawText() {
        return (String) getRawValue();
    }

    public String getRepairedText() {
        return repairedText;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
