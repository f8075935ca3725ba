package dev.pekelund.invoice.reconcile;

import dev.pekelund.invoice.model.FieldPaths;
import dev.pekelund.invoice.model.InvoiceData;
import dev.pekelund.invoice.model.InvoiceSchema;
import dev.pekelund.invoice.model.ReconciledLevel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a model's invoice reply into a validated {@link InvoiceData}: repairs the text,
 * decodes it, rewrites null synonyms and reconciles the tree against
 * {@link InvoiceSchema#INVOICE}. A pass either returns a complete record or throws one of
 * {@link MalformedResponseException}, {@link SchemaMismatchException} or
 * {@link dev.pekelund.invoice.model.FieldValidationException}.
 *
 * <p>The reconciler keeps no per-call state, so one instance can serve concurrent callers.
 */
public class InvoiceResponseReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceResponseReconciler.class);

    private final List<ResponseRepairStep> repairSteps;
    private final JsonResponseDecoder decoder;
    private final NullSynonymNormalizer nullSynonymNormalizer;
    private final SchemaReconciler schemaReconciler;

    public InvoiceResponseReconciler() {
        this(defaultRepairSteps(), new JsonResponseDecoder(), new NullSynonymNormalizer(), new SchemaReconciler());
    }

    public InvoiceResponseReconciler(List<ResponseRepairStep> repairSteps, JsonResponseDecoder decoder,
        NullSynonymNormalizer nullSynonymNormalizer, SchemaReconciler schemaReconciler) {
        this.repairSteps = List.copyOf(Objects.requireNonNull(repairSteps, "repairSteps"));
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.nullSynonymNormalizer = Objects.requireNonNull(nullSynonymNormalizer, "nullSynonymNormalizer");
        this.schemaReconciler = Objects.requireNonNull(schemaReconciler, "schemaReconciler");
    }

    /**
     * Fence and quote repair followed by digit group separator removal.
     */
    public static List<ResponseRepairStep> defaultRepairSteps() {
        return List.of(new ResponseSanitizer(), new NumericLiteralCleaner());
    }

    public InvoiceData reconcile(String rawResponse) {
        ensureNotAborted();
        String repaired = repair(rawResponse);
        Object decoded = decoder.decode(rawResponse, repaired);
        return reconcileDecoded(decoded);
    }

    /**
     * Runs the pipeline from null normalisation onward on an already decoded tree.
     */
    public InvoiceData reconcileTree(Object decoded) {
        ensureNotAborted();
        return reconcileDecoded(decoded);
    }

    String repair(String rawResponse) {
        String text = rawResponse != null ? rawResponse : "";
        for (ResponseRepairStep step : repairSteps) {
            text = step.apply(text);
        }
        return text;
    }

    private InvoiceData reconcileDecoded(Object decoded) {
        Object normalized = nullSynonymNormalizer.normalize(decoded);
        if (!(normalized instanceof Map<?, ?> root)) {
            throw new SchemaMismatchException(FieldPaths.ROOT, "object", normalized);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Normalized invoice reply: {}", normalized);
        }

        ReconciledLevel level = schemaReconciler.reconcile(root, InvoiceSchema.INVOICE, FieldPaths.ROOT);
        level = level.withOverflow(unknownTopLevelFields(root));
        InvoiceData invoice = InvoiceData.from(level);
        LOGGER.info("Reconciled invoice reply into {} line items with {} top-level overflow fields",
            invoice.lineItems().size(), invoice.extraFields().size());
        return invoice;
    }

    private Map<String, Object> unknownTopLevelFields(Map<?, ?> root) {
        Map<String, Object> unknown = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : root.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!InvoiceSchema.INVOICE.declares(key) && !InvoiceSchema.OVERFLOW_FIELD.equals(key)) {
                unknown.put(key, entry.getValue());
            }
        }
        if (!unknown.isEmpty()) {
            LOGGER.info("Unknown top-level fields detected: {}", unknown.keySet());
        }
        return unknown;
    }

    private void ensureNotAborted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Invoice reconciliation was aborted before it started");
        }
    }
}
