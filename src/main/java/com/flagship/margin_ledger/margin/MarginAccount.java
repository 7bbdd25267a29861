package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's margin account for one (tenant, broker).
 *
 * Money lives in the backing ledger account {@code ledgerAccountId}; the figures here
 * are derived from it and from the open positions:
 * - totalEquity = ledger balance + unrealized P&L of open positions
 * - usedMargin = initial margin of open positions
 * - availableBalance = max(0, min(ledger available balance, totalEquity - usedMargin))
 * - marginLevel = totalEquity / usedMargin * 100, or 0 without open positions
 */
@Value
@Builder(toBuilder = true)
public class MarginAccount {
    String id;
    String userId;
    String tenantId;
    String brokerId;
    MarginAccountType accountType;
    String symbol;
    String ledgerAccountId;
    CurrencyCode currency;
    BigDecimal totalEquity;
    BigDecimal usedMargin;
    BigDecimal availableBalance;
    BigDecimal marginLevel;
    int maxLeverage;
    int riskScore;
    MarginAccountStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static String ledgerAccountIdFor(String marginAccountId) {
        return "margin:" + marginAccountId;
    }

    public boolean isOwnedBy(String userId, String tenantId, String brokerId) {
        return this.userId.equals(userId) && this.tenantId.equals(tenantId) && this.brokerId.equals(brokerId);
    }

    public MarginAccount withStatus(MarginAccountStatus status, Instant now) {
        return toBuilder().status(status).updatedAt(now).build();
    }
}
