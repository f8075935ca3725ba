package dev.pekelund.invoice.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InvoiceDataJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serialisesWithWireNames() throws Exception {
        PartyDetails vendor = new PartyDetails("Acme", null, null, "SE1", Map.of("web", "acme.example"));
        InvoiceMetadata metadata = new InvoiceMetadata("INV-1", "2024-01-01", null, "EUR", vendor,
            new PartyDetails(null, null, null, null, Map.of()), Map.of("reference_numbers", List.of("PO-1")), Map.of());
        LineItem item = new LineItem(null, "Support", null, BigDecimal.ONE, null, null, null, null, null,
            new BigDecimal("99.90"), null, List.of(), FlexibleContent.text("priority"), Map.of());
        Totals totals = new Totals(null, null, List.of(), List.of(), null, null, new BigDecimal("99.90"), null, "EUR",
            Map.of());
        InvoiceData invoice = new InvoiceData("invoice", metadata, List.of(item), totals, null,
            FlexibleContent.structured(Map.of("notes", "none")), Map.of("page_count", 1));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(invoice));

        assertThat(json.path("document_type").asText()).isEqualTo("invoice");
        assertThat(json.path("invoice_metadata").path("vendor_details").path("tax_id").asText()).isEqualTo("SE1");
        assertThat(json.path("invoice_metadata").path("vendor_details").path("extra_fields").path("web").asText())
            .isEqualTo("acme.example");
        assertThat(json.path("invoice_metadata").path("additional_metadata").path("reference_numbers").isArray())
            .isTrue();
        assertThat(json.path("line_items").get(0).path("extra_details").isTextual()).isTrue();
        assertThat(json.path("line_items").get(0).path("total").decimalValue()).isEqualByComparingTo("99.90");
        assertThat(json.path("totals").path("grand_total").isNumber()).isTrue();
        assertThat(json.has("payment_slip")).isTrue();
        assertThat(json.path("payment_slip").isNull()).isTrue();
        assertThat(json.path("unstructured_content").path("notes").asText()).isEqualTo("none");
        assertThat(json.path("extra_fields").path("page_count").asInt()).isEqualTo(1);
        assertThat(json.has("documentType")).isFalse();
    }

    @Test
    void treatsMissingCollectionsAsEmpty() {
        InvoiceData invoice = new InvoiceData(null, null, null, null, null, null, null);

        assertThat(invoice.lineItems()).isEmpty();
        assertThat(invoice.extraFields()).isEmpty();
    }
}
