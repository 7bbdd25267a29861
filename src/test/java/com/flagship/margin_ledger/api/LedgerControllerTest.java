package com.flagship.margin_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Ledger API over the in-memory stores: posting, idempotent replay, holds and error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String tenantId;
    private String funding;
    private String wallet;

    @BeforeEach
    void setUp() throws Exception {
        tenantId = "tenant-" + UUID.randomUUID().toString().substring(0, 8);
        funding = tenantId + ":funding:USD";
        wallet = tenantId + ":wallet";

        openAccount(funding, true);
        openAccount(wallet, false);
    }

    private void openAccount(String accountId, boolean overdraft) throws Exception {
        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/accounts", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of(
                    "account_id", accountId, "currency", "USD", "overdraft_allowed", overdraft))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(accountId))
            .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    private String transfer(String from, String to, String amount) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "description", "transfer",
            "lines", List.of(
                Map.of("account_id", from, "debit", new BigDecimal(amount), "currency", "USD"),
                Map.of("account_id", to, "credit", new BigDecimal(amount), "currency", "USD"))));
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private BigDecimal decimal(JsonNode node, String field) {
        return new BigDecimal(node.get(field).asText());
    }

    @Test
    @DisplayName("Posting an entry moves balances and the Idempotency-Key replays it")
    void postAndReplay() throws Exception {
        String key = "deposit-" + UUID.randomUUID();

        MvcResult first = mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .header("Idempotency-Key", key)
                .header("X-Correlation-ID", "corr-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(transfer(funding, wallet, "250.00")))
            .andExpect(status().isCreated())
            .andExpect(header().string("X-Correlation-ID", "corr-123"))
            .andExpect(jsonPath("$.idempotency_key").value(key))
            .andExpect(jsonPath("$.lines.length()").value(2))
            .andReturn();

        MvcResult replay = mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transfer(funding, wallet, "250.00")))
            .andExpect(status().isCreated())
            .andReturn();

        assertEquals(body(first).get("id").asText(), body(replay).get("id").asText());

        JsonNode balance = body(mockMvc.perform(get("/api/ledger/accounts/{id}/balance", wallet))
            .andExpect(status().isOk())
            .andReturn());
        assertEquals(0, decimal(balance, "balance").compareTo(new BigDecimal("250")));
        assertEquals(0, decimal(balance, "available_balance").compareTo(new BigDecimal("250")));

        mockMvc.perform(get("/api/ledger/tenants/{tenantId}/journal-entries", tenantId).param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Unbalanced entries are 400 UNBALANCED_ENTRY")
    void unbalanced() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "description", "broken",
            "lines", List.of(
                Map.of("account_id", funding, "debit", new BigDecimal("100"), "currency", "USD"),
                Map.of("account_id", wallet, "credit", new BigDecimal("90"), "currency", "USD"))));

        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("UNBALANCED_ENTRY"));
    }

    @Test
    @DisplayName("Overdrawing a non-overdraft account is 409 INSUFFICIENT_AVAILABLE_BALANCE")
    void insufficientBalance() throws Exception {
        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transfer(wallet, funding, "1.00")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_AVAILABLE_BALANCE"));
    }

    @Test
    @DisplayName("Request validation failures list the offending fields")
    void requestValidation() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "description", "one line",
            "lines", List.of(Map.of("account_id", wallet, "credit", new BigDecimal("1"), "currency", "USD"))));

        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION"))
            .andExpect(jsonPath("$.details.lines").exists());
    }

    @Test
    @DisplayName("Unknown accounts are 404 NOT_FOUND")
    void unknownAccount() throws Exception {
        mockMvc.perform(get("/api/ledger/accounts/{id}", "missing-" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("A hold reserves funds until it is released")
    void holdLifecycle() throws Exception {
        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transfer(funding, wallet, "100.00")))
            .andExpect(status().isCreated());

        JsonNode hold = body(mockMvc.perform(post("/api/ledger/tenants/{tenantId}/holds", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of(
                    "account_id", wallet, "amount", new BigDecimal("60"), "currency", "USD",
                    "description", "card authorization"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andReturn());

        JsonNode account = body(mockMvc.perform(get("/api/ledger/accounts/{id}", wallet))
            .andExpect(status().isOk())
            .andReturn());
        assertEquals(0, decimal(account, "available_balance").compareTo(new BigDecimal("40")));

        mockMvc.perform(post("/api/ledger/tenants/{tenantId}/journal-entries", tenantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transfer(wallet, funding, "50.00")))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/ledger/tenants/{tenantId}/holds", tenantId).param("status", "ACTIVE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/ledger/holds/{holdId}", hold.get("id").asText()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_id").value(wallet));

        mockMvc.perform(post("/api/ledger/holds/{holdId}/release", hold.get("id").asText()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RELEASED"));

        mockMvc.perform(post("/api/ledger/holds/{holdId}/release", hold.get("id").asText()))
            .andExpect(status().isNotFound());
    }
}
