package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.MarginAccount;
import com.flagship.margin_ledger.margin.MarginAccountStatus;
import com.flagship.margin_ledger.margin.MarginAccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class MarginAccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("broker_id")
    String brokerId;

    @JsonProperty("account_type")
    MarginAccountType accountType;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("ledger_account_id")
    String ledgerAccountId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("total_equity")
    BigDecimal totalEquity;

    @JsonProperty("used_margin")
    BigDecimal usedMargin;

    @JsonProperty("available_balance")
    BigDecimal availableBalance;

    @JsonProperty("margin_level")
    BigDecimal marginLevel;

    @JsonProperty("max_leverage")
    int maxLeverage;

    @JsonProperty("risk_score")
    int riskScore;

    @JsonProperty("status")
    MarginAccountStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MarginAccountResponse from(MarginAccount account) {
        return MarginAccountResponse.builder()
                .id(account.getId())
                .userId(account.getUserId())
                .tenantId(account.getTenantId())
                .brokerId(account.getBrokerId())
                .accountType(account.getAccountType())
                .symbol(account.getSymbol())
                .ledgerAccountId(account.getLedgerAccountId())
                .currency(account.getCurrency().name())
                .totalEquity(account.getTotalEquity())
                .usedMargin(account.getUsedMargin())
                .availableBalance(account.getAvailableBalance())
                .marginLevel(account.getMarginLevel())
                .maxLeverage(account.getMaxLeverage())
                .riskScore(account.getRiskScore())
                .status(account.getStatus())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }
}
