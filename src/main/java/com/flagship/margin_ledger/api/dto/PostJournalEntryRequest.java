package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class PostJournalEntryRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @Valid
    @Size(min = 2, message = "A journal entry needs at least two lines")
    @JsonProperty("lines")
    List<JournalLineRequest> lines;

    @JsonProperty("metadata")
    Map<String, String> metadata;
}
