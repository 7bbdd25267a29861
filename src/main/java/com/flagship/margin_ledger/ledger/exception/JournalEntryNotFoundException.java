package com.flagship.margin_ledger.ledger.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

import java.util.UUID;

public class JournalEntryNotFoundException extends DomainException {

    public JournalEntryNotFoundException(UUID entryId) {
        super(ErrorKind.NOT_FOUND, "Journal entry not found: " + entryId);
    }
}
