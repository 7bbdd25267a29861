package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface HoldStore {

    void insert(Hold hold);

    void update(Hold hold);

    Optional<Hold> findById(UUID holdId);

    List<Hold> findActiveByAccount(String accountId);

    /**
     * Holds of a tenant, optionally filtered by status.
     */
    List<Hold> findByTenant(String tenantId, HoldStatus status);

    /**
     * ACTIVE holds whose expiry is at or before {@code now}.
     */
    List<Hold> findDue(Instant now);
}
