package com.flagship.margin_ledger.external;

/**
 * Client of the external ledger used for reconciliation and journal export.
 * Implementations never retry; failures surface as {@link ExternalServiceException}.
 */
public interface ExternalLedgerClient {

    ExternalTransactionReceipt recordTransaction(ExternalTransactionRequest request);

    ExternalAccountBalance getAccountBalance(String tenantId, String accountId, String currency);
}
