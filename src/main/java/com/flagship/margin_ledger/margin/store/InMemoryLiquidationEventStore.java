package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.LiquidationEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryLiquidationEventStore implements LiquidationEventStore {

    private final List<LiquidationEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void insert(LiquidationEvent event) {
        events.add(event);
    }

    @Override
    public List<LiquidationEvent> findByAccount(String accountId) {
        return events.stream()
            .filter(e -> e.getAccountId().equals(accountId))
            .toList();
    }
}
