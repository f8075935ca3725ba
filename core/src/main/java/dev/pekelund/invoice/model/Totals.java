package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Summary amounts of an invoice. Partial totals and taxes keep whatever structure the
 * document used for them.
 */
public record Totals(
    @JsonProperty("previous_balance") BigDecimal previousBalance,
    @JsonProperty("current_charges") BigDecimal currentCharges,
    @JsonProperty("partial_totals") List<Object> partialTotals,
    @JsonProperty("taxes") List<Object> taxes,
    @JsonProperty("discounts") BigDecimal discounts,
    @JsonProperty("adjustments") BigDecimal adjustments,
    @JsonProperty("grand_total") BigDecimal grandTotal,
    @JsonProperty("amount_in_words") String amountInWords,
    @JsonProperty("currency") String currency,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public Totals {
        partialTotals = ModelCopies.list(partialTotals);
        taxes = ModelCopies.list(taxes);
        extraFields = ModelCopies.map(extraFields);
    }

    public static Totals from(ReconciledLevel level) {
        return new Totals(
            level.decimal("previous_balance"),
            level.decimal("current_charges"),
            level.sequence("partial_totals"),
            level.sequence("taxes"),
            level.decimal("discounts"),
            level.decimal("adjustments"),
            level.decimal("grand_total"),
            level.text("amount_in_words"),
            level.text("currency"),
            level.overflow());
    }
}
