package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record BankDetails(
    @JsonProperty("account_name") String accountName,
    @JsonProperty("account_number") String accountNumber,
    @JsonProperty("bank_name") String bankName,
    @JsonProperty("extra_fields") Map<String, Object> extraFields
) {

    public BankDetails {
        extraFields = ModelCopies.map(extraFields);
    }

    public static BankDetails from(ReconciledLevel level) {
        return new BankDetails(
            level.text("account_name"),
            level.text("account_number"),
            level.text("bank_name"),
            level.overflow());
    }
}
