package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.CloseResult;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CloseResponse {

    @JsonProperty("position")
    PositionResponse position;

    @JsonProperty("realized_pnl")
    BigDecimal realizedPnl;

    @JsonProperty("journal_entry_id")
    UUID journalEntryId;

    @JsonProperty("uncovered_loss")
    BigDecimal uncoveredLoss;

    public static CloseResponse from(CloseResult result) {
        return new CloseResponse(PositionResponse.from(result.getPosition()), result.getRealizedPnl(),
                result.getJournalEntryId(), result.getUncoveredLoss());
    }
}
