package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Identifying data of an invoice and the parties involved.
 */
public record InvoiceMetadata(
    @JsonProperty("invoice_number") String invoiceNumber,
    @JsonProperty("invoice_date") String invoiceDate,
    @JsonProperty("due_date") String dueDate,
    @JsonProperty("currency") String currency,
    @JsonProperty("vendor_details") PartyDetails vendorDetails,
    @JsonProperty("customer_details") PartyDetails customerDetails,
    @JsonProperty("additional_metadata") Map<String, Object> additionalMetadata,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public InvoiceMetadata {
        additionalMetadata = ModelCopies.map(additionalMetadata);
        extraFields = ModelCopies.map(extraFields);
    }

    public static InvoiceMetadata from(ReconciledLevel level) {
        return new InvoiceMetadata(
            level.text("invoice_number"),
            level.text("invoice_date"),
            level.text("due_date"),
            level.text("currency"),
            PartyDetails.from(level.requiredChild("vendor_details")),
            PartyDetails.from(level.requiredChild("customer_details")),
            level.map("additional_metadata"),
            level.overflow());
    }
}
