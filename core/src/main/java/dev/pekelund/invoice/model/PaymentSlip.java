package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Detachable payment slip printed on some invoices.
 */
public record PaymentSlip(
    @JsonProperty("payment_amount") BigDecimal paymentAmount,
    @JsonProperty("payment_due_date") String paymentDueDate,
    @JsonProperty("reference_number") String referenceNumber,
    @JsonProperty("bank_details") BankDetails bankDetails,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public PaymentSlip {
        extraFields = ModelCopies.map(extraFields);
    }

    public static PaymentSlip from(ReconciledLevel level) {
        ReconciledLevel bankDetails = level.child("bank_details");
        return new PaymentSlip(
            level.decimal("payment_amount"),
            level.text("payment_due_date"),
            level.text("reference_number"),
            bankDetails != null ? BankDetails.from(bankDetails) : null,
            level.overflow());
    }
}
