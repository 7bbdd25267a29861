package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("description")
    String description;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class Line {

        @JsonProperty("account_id")
        String accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("currency")
        String currency;

        @JsonProperty("description")
        String description;

        static Line from(JournalLine line) {
            return new Line(line.getAccountId(), line.getDebit(), line.getCredit(),
                    line.getCurrency().name(), line.getDescription());
        }
    }

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
                .id(entry.getId())
                .tenantId(entry.getTenantId())
                .description(entry.getDescription())
                .lines(entry.getLines().stream().map(Line::from).toList())
                .idempotencyKey(entry.getIdempotencyKey())
                .metadata(entry.getMetadata())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
