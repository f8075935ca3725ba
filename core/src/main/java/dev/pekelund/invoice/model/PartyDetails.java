package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Vendor or customer block of an invoice.
 */
public record PartyDetails(
    @JsonProperty("name") String name,
    @JsonProperty("address") String address,
    @JsonProperty("contact") String contact,
    @JsonProperty("tax_id") String taxId,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public PartyDetails {
        extraFields = ModelCopies.map(extraFields);
    }

    public static PartyDetails from(ReconciledLevel level) {
        return new PartyDetails(
            level.text("name"),
            level.text("address"),
            level.text("contact"),
            level.text("tax_id"),
            level.overflow());
    }
}
