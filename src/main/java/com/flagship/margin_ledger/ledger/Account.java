package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A ledger participant.
 *
 * Key invariants:
 * - availableBalance = balance - sum(active holds), so availableBalance <= balance
 * - accounts without overdraft never carry a negative balance or available balance
 * - accounts are never deleted, only closed
 *
 * Instances are immutable; state changes produce a new Account.
 */
@Value
public class Account {
    String id;
    String tenantId;
    CurrencyCode currency;
    BigDecimal balance;
    BigDecimal availableBalance;
    boolean overdraftAllowed;
    Status status;
    Instant createdAt;
    Instant updatedAt;

    public enum Status {
        ACTIVE,
        CLOSED
    }

    /**
     * Creates a new ACTIVE account with zero balances.
     */
    public static Account open(String id, String tenantId, CurrencyCode currency,
                               boolean overdraftAllowed, Instant now) {
        return new Account(id, tenantId, currency, currency.zero(), currency.zero(),
            overdraftAllowed, Status.ACTIVE, now, now);
    }

    /**
     * Returns this account with new balance figures.
     */
    public Account withBalances(BigDecimal balance, BigDecimal availableBalance, Instant now) {
        return new Account(id, tenantId, currency, currency.normalize(balance),
            currency.normalize(availableBalance), overdraftAllowed, status, createdAt, now);
    }

    /**
     * Soft-closes the account.
     *
     * @throws IllegalStateException if the account is already closed
     */
    public Account close(Instant now) {
        if (status == Status.CLOSED) {
            throw new IllegalStateException("Account " + id + " is already closed");
        }
        return new Account(id, tenantId, currency, balance, availableBalance,
            overdraftAllowed, Status.CLOSED, createdAt, now);
    }

    public boolean isClosed() {
        return status == Status.CLOSED;
    }

    /**
     * Total amount currently reserved by active holds.
     */
    public BigDecimal getHeldAmount() {
        return balance.subtract(availableBalance);
    }
}
