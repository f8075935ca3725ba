package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Root of the validated invoice record. Serialised to JSON it is the document returned to
 * callers of the extraction service.
 */
public record InvoiceData(
    @JsonProperty("document_type") String documentType,
    @JsonProperty("invoice_metadata") InvoiceMetadata invoiceMetadata,
    @JsonProperty("line_items") List<LineItem> lineItems,
    @JsonProperty("totals") Totals totals,
    @JsonProperty("payment_slip") PaymentSlip paymentSlip,
    @JsonProperty("unstructured_content") FlexibleContent unstructuredContent,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public InvoiceData {
        lineItems = ModelCopies.list(lineItems);
        extraFields = ModelCopies.map(extraFields);
    }

    public static InvoiceData from(ReconciledLevel level) {
        ReconciledLevel paymentSlip = level.child("payment_slip");
        return new InvoiceData(
            level.text("document_type"),
            InvoiceMetadata.from(level.requiredChild("invoice_metadata")),
            level.children("line_items").stream()
                .map(LineItem::from)
                .collect(Collectors.toList()),
            Totals.from(level.requiredChild("totals")),
            paymentSlip != null ? PaymentSlip.from(paymentSlip) : null,
            level.flexible("unstructured_content"),
            level.overflow());
    }
}
