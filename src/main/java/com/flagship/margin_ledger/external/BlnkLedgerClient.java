package com.flagship.margin_ledger.external;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

/**
 * REST client for a BlnkFinance-style external ledger.
 *
 * Endpoints:
 * - POST /v1/ledger/entries: record a transaction, returns {@code {id, reference, status}}
 * - GET /v1/accounts/{id}/balance?tenant_id=&currency=: balance, either wrapped in
 *   {@code {"balance": {...}}} or flat, with the net figure in {@code balance} or {@code total}
 */
@Component
@Slf4j
public class BlnkLedgerClient implements ExternalLedgerClient {

    private final RestTemplate restTemplate;

    public BlnkLedgerClient(@Qualifier("externalLedgerRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ExternalTransactionReceipt recordTransaction(ExternalTransactionRequest request) {
        try {
            ExternalTransactionReceipt receipt =
                restTemplate.postForObject("/v1/ledger/entries", request, ExternalTransactionReceipt.class);
            if (receipt == null || receipt.getId() == null) {
                throw new ExternalServiceException("External ledger returned no transaction id for " + request.getReference());
            }
            log.info("Transaction recorded in external ledger: reference={}, externalId={}",
                request.getReference(), receipt.getId());
            return receipt;
        } catch (RestClientException e) {
            log.warn("External ledger call failed for reference {}: {}", request.getReference(), e.getMessage());
            throw new ExternalServiceException("External ledger unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public ExternalAccountBalance getAccountBalance(String tenantId, String accountId, String currency) {
        JsonNode body;
        try {
            body = restTemplate.getForObject(
                "/v1/accounts/{accountId}/balance?tenant_id={tenantId}&currency={currency}",
                JsonNode.class, accountId, tenantId, currency);
        } catch (RestClientException e) {
            log.warn("External balance lookup failed for account {}: {}", accountId, e.getMessage());
            throw new ExternalServiceException("External ledger unavailable: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new ExternalServiceException("External ledger returned no balance for " + accountId);
        }

        JsonNode balance = body.path("balance").isObject() ? body.path("balance") : body;
        JsonNode net = balance.hasNonNull("balance") ? balance.get("balance") : balance.get("total");
        if (net == null || net.isNull()) {
            throw new ExternalServiceException("External balance for " + accountId + " has no net figure");
        }
        String reportedCurrency = balance.hasNonNull("currency") ? balance.get("currency").asText() : currency;
        try {
            return new ExternalAccountBalance(accountId, new BigDecimal(net.asText()), reportedCurrency);
        } catch (NumberFormatException e) {
            throw new ExternalServiceException("External balance for " + accountId + " is not a number: " + net.asText(), e);
        }
    }
}
