package com.flagship.margin_ledger.margin;

public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    PROFESSIONAL
}
