package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A temporary reservation against an account's available balance.
 *
 * Transitions return a new Hold and are only valid from ACTIVE:
 * - release(): ACTIVE -> RELEASED
 * - expire():  ACTIVE -> EXPIRED
 */
@Value
public class Hold {
    UUID id;
    String tenantId;
    String accountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    HoldStatus status;
    Instant expiresAt;
    Map<String, String> metadata;
    Instant createdAt;
    Instant releasedAt;

    public static Hold create(UUID id, String tenantId, String accountId, BigDecimal amount,
                              CurrencyCode currency, String description, Instant expiresAt,
                              Map<String, String> metadata, Instant now) {
        return new Hold(id, tenantId, accountId, currency.normalize(amount), currency, description,
            HoldStatus.ACTIVE, expiresAt, metadata == null ? Map.of() : Map.copyOf(metadata), now, null);
    }

    public Hold release(Instant now) {
        return transition(HoldStatus.RELEASED, now);
    }

    public Hold expire(Instant now) {
        return transition(HoldStatus.EXPIRED, now);
    }

    private Hold transition(HoldStatus target, Instant now) {
        if (status != HoldStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot move hold %s from %s to %s. Only ACTIVE holds can change state.",
                    id, status, target));
        }
        return new Hold(id, tenantId, accountId, amount, currency, description, target,
            expiresAt, metadata, createdAt, now);
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }

    /**
     * True for an ACTIVE hold whose expiry has passed but which has not been swept yet.
     */
    public boolean isDue(Instant now) {
        return isActive() && expiresAt != null && !expiresAt.isAfter(now);
    }
}
