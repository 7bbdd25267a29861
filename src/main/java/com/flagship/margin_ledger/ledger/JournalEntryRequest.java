package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Request to post a journal entry.
 *
 * Lines are grouped per currency for the balance check; an entry may move
 * several currencies as long as each one balances on its own.
 */
@Value
@Builder
public class JournalEntryRequest {
    String tenantId;
    String description;
    @Singular
    List<JournalLine> lines;
    String idempotencyKey;
    Map<String, String> metadata;

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }

    public Map<CurrencyCode, BigDecimal> getDebitTotals() {
        Map<CurrencyCode, BigDecimal> totals = new EnumMap<>(CurrencyCode.class);
        for (JournalLine line : lines) {
            totals.merge(line.getCurrency(), line.getDebit(), BigDecimal::add);
        }
        return totals;
    }

    public Map<CurrencyCode, BigDecimal> getCreditTotals() {
        Map<CurrencyCode, BigDecimal> totals = new EnumMap<>(CurrencyCode.class);
        for (JournalLine line : lines) {
            totals.merge(line.getCurrency(), line.getCredit(), BigDecimal::add);
        }
        return totals;
    }
}
