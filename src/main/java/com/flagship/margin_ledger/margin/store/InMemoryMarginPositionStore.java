package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.MarginPosition;
import com.flagship.margin_ledger.margin.PositionStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryMarginPositionStore implements MarginPositionStore {

    private final Map<UUID, MarginPosition> positions = new ConcurrentHashMap<>();

    @Override
    public void insert(MarginPosition position) {
        if (positions.putIfAbsent(position.getId(), position) != null) {
            throw new IllegalStateException("Position already stored: " + position.getId());
        }
    }

    @Override
    public void update(MarginPosition position) {
        if (positions.replace(position.getId(), position) == null) {
            throw new IllegalStateException("Position not stored: " + position.getId());
        }
    }

    @Override
    public Optional<MarginPosition> findById(UUID positionId) {
        return Optional.ofNullable(positions.get(positionId));
    }

    @Override
    public List<MarginPosition> findByAccount(String accountId, PositionStatus status) {
        return positions.values().stream()
            .filter(p -> p.getAccountId().equals(accountId))
            .filter(p -> status == null || p.getStatus() == status)
            .sorted(Comparator.comparing(MarginPosition::getOpenedAt))
            .toList();
    }

    @Override
    public List<MarginPosition> findOpenBySymbol(String symbol) {
        return positions.values().stream()
            .filter(p -> p.isOpen() && p.getSymbol().equals(symbol))
            .sorted(Comparator.comparing(MarginPosition::getOpenedAt))
            .toList();
    }

    @Override
    public Set<String> findOpenSymbols() {
        return positions.values().stream()
            .filter(MarginPosition::isOpen)
            .map(MarginPosition::getSymbol)
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
