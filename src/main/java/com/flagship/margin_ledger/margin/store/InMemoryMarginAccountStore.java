package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.MarginAccount;
import com.flagship.margin_ledger.margin.MarginAccountStatus;
import com.flagship.margin_ledger.margin.RiskLimits;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMarginAccountStore implements MarginAccountStore {

    private final Map<String, MarginAccount> accounts = new ConcurrentHashMap<>();
    private final Map<String, String> idByOwner = new ConcurrentHashMap<>();

    @Override
    public Optional<MarginAccount> findById(String accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    @Override
    public Optional<MarginAccount> findByOwner(String userId, String tenantId, String brokerId) {
        String id = idByOwner.get(RiskLimits.key(userId, tenantId, brokerId));
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<MarginAccount> findByStatus(MarginAccountStatus status) {
        return accounts.values().stream()
            .filter(a -> a.getStatus() == status)
            .sorted(Comparator.comparing(MarginAccount::getCreatedAt))
            .toList();
    }

    @Override
    public void insert(MarginAccount account) {
        String owner = RiskLimits.key(account.getUserId(), account.getTenantId(), account.getBrokerId());
        if (idByOwner.putIfAbsent(owner, account.getId()) != null) {
            throw new IllegalStateException("Margin account already stored for " + owner);
        }
        accounts.put(account.getId(), account);
    }

    @Override
    public void update(MarginAccount account) {
        if (accounts.replace(account.getId(), account) == null) {
            throw new IllegalStateException("Margin account not stored: " + account.getId());
        }
    }
}
