package dev.pekelund.invoice.reconcile;

/**
 * A best-effort textual repair applied to a model reply before it is parsed as JSON.
 * Steps never fail; text they cannot fix surfaces later as a decode failure.
 */
@FunctionalInterface
public interface ResponseRepairStep {

    /**
     * @param text the reply as produced by the previous step, never {@code null}
     * @return the repaired text, never {@code null}
     */
    String apply(String text);
}
