package com.flagship.margin_ledger.margin;

public enum LiquidationReason {
    MARGIN_CALL,
    FORCED_LIQUIDATION,
    RISK_LIMIT_EXCEEDED
}
