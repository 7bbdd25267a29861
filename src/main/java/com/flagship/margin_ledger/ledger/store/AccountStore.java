package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.Account;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for ledger accounts. Callers hold the account lock for any write.
 */
public interface AccountStore {

    Optional<Account> findById(String accountId);

    List<Account> findByTenant(String tenantId);

    void insert(Account account);

    void update(Account account);
}
