package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One invoice row.
 */
public record LineItem(
    @JsonProperty("transaction_date") String transactionDate,
    @JsonProperty("description") String description,
    @JsonProperty("transaction_type") String transactionType,
    @JsonProperty("quantity") BigDecimal quantity,
    @JsonProperty("unit") String unit,
    @JsonProperty("unit_price") BigDecimal unitPrice,
    @JsonProperty("tax_rate") BigDecimal taxRate,
    @JsonProperty("tax_amount") BigDecimal taxAmount,
    @JsonProperty("subtotal") BigDecimal subtotal,
    @JsonProperty("total") BigDecimal total,
    @JsonProperty("status") String status,
    @JsonProperty("sub_items") List<Object> subItems,
    @JsonProperty("extra_details") FlexibleContent extraDetails,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public LineItem {
        subItems = ModelCopies.list(subItems);
        extraFields = ModelCopies.map(extraFields);
    }

    public static LineItem from(ReconciledLevel level) {
        return new LineItem(
            level.text("transaction_date"),
            level.text("description"),
            level.text("transaction_type"),
            level.decimal("quantity"),
            level.text("unit"),
            level.decimal("unit_price"),
            level.decimal("tax_rate"),
            level.decimal("tax_amount"),
            level.decimal("subtotal"),
            level.decimal("total"),
            level.text("status"),
            level.sequence("sub_items"),
            level.flexible("extra_details"),
            level.overflow());
    }
}
