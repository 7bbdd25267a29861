package com.flagship.margin_ledger.margin;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of closing a position.
 *
 * {@code journalEntryId} is null when the realized P&L is zero. {@code uncoveredLoss}
 * is the part of a loss the margin account could not pay.
 */
@Value
public class CloseResult {
    MarginPosition position;
    BigDecimal realizedPnl;
    UUID journalEntryId;
    BigDecimal uncoveredLoss;
}
