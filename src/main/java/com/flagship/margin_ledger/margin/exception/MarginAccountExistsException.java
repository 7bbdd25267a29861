package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

/**
 * The (user, tenant, broker) triple already owns a margin account.
 */
public class MarginAccountExistsException extends DomainException {

    public MarginAccountExistsException(String userId, String tenantId, String brokerId, String existingId) {
        super(ErrorKind.ALREADY_EXISTS, String.format(
            "Margin account already exists for user %s, tenant %s, broker %s: %s", userId, tenantId, brokerId, existingId));
    }
}
