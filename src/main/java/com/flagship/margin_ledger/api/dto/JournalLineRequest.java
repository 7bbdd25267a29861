package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.JournalLine;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class JournalLineRequest {

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    /**
     * An omitted side is zero.
     */
    public JournalLine toLine() {
        return new JournalLine(
                accountId,
                debit == null ? BigDecimal.ZERO : debit,
                credit == null ? BigDecimal.ZERO : credit,
                CurrencyCode.parse(currency),
                description);
    }
}
