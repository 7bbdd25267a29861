package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.MarginAccount;
import com.flagship.margin_ledger.margin.MarginAccountStatus;

import java.util.List;
import java.util.Optional;

public interface MarginAccountStore {

    Optional<MarginAccount> findById(String accountId);

    Optional<MarginAccount> findByOwner(String userId, String tenantId, String brokerId);

    List<MarginAccount> findByStatus(MarginAccountStatus status);

    void insert(MarginAccount account);

    void update(MarginAccount account);
}
