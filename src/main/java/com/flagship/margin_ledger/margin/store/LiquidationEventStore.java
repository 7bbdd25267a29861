package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.LiquidationEvent;

import java.util.List;

public interface LiquidationEventStore {

    void insert(LiquidationEvent event);

    List<LiquidationEvent> findByAccount(String accountId);
}
