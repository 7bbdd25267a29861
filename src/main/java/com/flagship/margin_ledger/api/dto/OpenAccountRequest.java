package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class OpenAccountRequest {

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("overdraft_allowed")
    boolean overdraftAllowed;
}
