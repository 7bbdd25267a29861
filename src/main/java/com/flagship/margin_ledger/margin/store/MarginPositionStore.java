package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.MarginPosition;
import com.flagship.margin_ledger.margin.PositionStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface MarginPositionStore {

    void insert(MarginPosition position);

    void update(MarginPosition position);

    Optional<MarginPosition> findById(UUID positionId);

    /**
     * Positions of an account, optionally filtered by status, oldest first.
     */
    List<MarginPosition> findByAccount(String accountId, PositionStatus status);

    List<MarginPosition> findOpenBySymbol(String symbol);

    Set<String> findOpenSymbols();
}
