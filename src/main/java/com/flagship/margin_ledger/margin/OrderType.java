package com.flagship.margin_ledger.margin;

public enum OrderType {
    MARKET,
    LIMIT
}
