package dev.pekelund.invoice.model;

import static dev.pekelund.invoice.model.FieldDefinition.decimal;
import static dev.pekelund.invoice.model.FieldDefinition.flexible;
import static dev.pekelund.invoice.model.FieldDefinition.map;
import static dev.pekelund.invoice.model.FieldDefinition.optionalRecord;
import static dev.pekelund.invoice.model.FieldDefinition.record;
import static dev.pekelund.invoice.model.FieldDefinition.recordList;
import static dev.pekelund.invoice.model.FieldDefinition.sequence;
import static dev.pekelund.invoice.model.FieldDefinition.text;

/**
 * The invoice record hierarchy as a tree of {@link RecordSchema} levels. The wire names
 * declared here are the ones the record types serialise to.
 */
public final class InvoiceSchema {

    /**
     * Wire name of the overflow container carried by every level.
     */
    public static final String OVERFLOW_FIELD = "extra_fields";

    /**
     * Entry of the additional metadata map that is always a sequence of strings.
     */
    public static final String ADDITIONAL_METADATA = "additional_metadata";
    public static final String REFERENCE_NUMBERS = "reference_numbers";

    public static final RecordSchema VENDOR_DETAILS = party("vendor_details");

    public static final RecordSchema CUSTOMER_DETAILS = party("customer_details");

    public static final RecordSchema INVOICE_METADATA = RecordSchema.of("invoice_metadata",
        text("invoice_number"),
        text("invoice_date"),
        text("due_date"),
        text("currency"),
        record("vendor_details", VENDOR_DETAILS),
        record("customer_details", CUSTOMER_DETAILS),
        map(ADDITIONAL_METADATA));

    public static final RecordSchema LINE_ITEM = RecordSchema.of("line_item",
        text("transaction_date"),
        text("description"),
        text("transaction_type"),
        decimal("quantity"),
        text("unit"),
        decimal("unit_price"),
        decimal("tax_rate"),
        decimal("tax_amount"),
        decimal("subtotal"),
        decimal("total"),
        text("status"),
        sequence("sub_items"),
        flexible("extra_details"));

    public static final RecordSchema TOTALS = RecordSchema.of("totals",
        decimal("previous_balance"),
        decimal("current_charges"),
        sequence("partial_totals"),
        sequence("taxes"),
        decimal("discounts"),
        decimal("adjustments"),
        decimal("grand_total"),
        text("amount_in_words"),
        text("currency"));

    public static final RecordSchema BANK_DETAILS = RecordSchema.of("bank_details",
        text("account_name"),
        text("account_number"),
        text("bank_name"));

    public static final RecordSchema PAYMENT_SLIP = RecordSchema.of("payment_slip",
        decimal("payment_amount"),
        text("payment_due_date"),
        text("reference_number"),
        optionalRecord("bank_details", BANK_DETAILS));

    public static final RecordSchema INVOICE = RecordSchema.of("invoice",
        text("document_type"),
        record("invoice_metadata", INVOICE_METADATA),
        recordList("line_items", LINE_ITEM),
        record("totals", TOTALS),
        optionalRecord("payment_slip", PAYMENT_SLIP),
        flexible("unstructured_content"));

    private InvoiceSchema() {
    }

    private static RecordSchema party(String name) {
        return RecordSchema.of(name,
            text("name"),
            text("address"),
            text("contact"),
            text("tax_id"));
    }
}
