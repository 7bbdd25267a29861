package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.Account;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAccountStore implements AccountStore {

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();

    @Override
    public Optional<Account> findById(String accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    @Override
    public List<Account> findByTenant(String tenantId) {
        return accounts.values().stream()
            .filter(a -> a.getTenantId().equals(tenantId))
            .sorted(Comparator.comparing(Account::getId))
            .toList();
    }

    @Override
    public void insert(Account account) {
        if (accounts.putIfAbsent(account.getId(), account) != null) {
            throw new IllegalStateException("Account already stored: " + account.getId());
        }
    }

    @Override
    public void update(Account account) {
        if (accounts.replace(account.getId(), account) == null) {
            throw new IllegalStateException("Account not stored: " + account.getId());
        }
    }
}
