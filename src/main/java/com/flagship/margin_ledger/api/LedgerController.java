package com.flagship.margin_ledger.api;

import com.flagship.margin_ledger.api.dto.AccountResponse;
import com.flagship.margin_ledger.api.dto.BalanceResponse;
import com.flagship.margin_ledger.api.dto.CreateHoldRequest;
import com.flagship.margin_ledger.api.dto.HoldResponse;
import com.flagship.margin_ledger.api.dto.JournalEntryResponse;
import com.flagship.margin_ledger.api.dto.JournalLineRequest;
import com.flagship.margin_ledger.api.dto.OpenAccountRequest;
import com.flagship.margin_ledger.api.dto.PostJournalEntryRequest;
import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.HoldRequest;
import com.flagship.margin_ledger.ledger.HoldStatus;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for ledger accounts, journal entries and holds.
 *
 * Journal posting is idempotent when an Idempotency-Key header is sent:
 * a repeated key returns the originally posted entry.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;

    @PostMapping("/tenants/{tenantId}/accounts")
    public ResponseEntity<AccountResponse> openAccount(
            @PathVariable("tenantId") String tenantId,
            @Valid @RequestBody OpenAccountRequest request) {
        var account = ledgerService.openAccount(tenantId, request.getAccountId(),
                CurrencyCode.parse(request.getCurrency()), request.isOverdraftAllowed());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/accounts/{accountId}")
    public AccountResponse getAccount(@PathVariable("accountId") String accountId) {
        return AccountResponse.from(ledgerService.getAccount(accountId));
    }

    @GetMapping("/accounts/{accountId}/balance")
    public BalanceResponse getBalance(@PathVariable("accountId") String accountId) {
        return BalanceResponse.from(ledgerService.getAccountBalance(accountId));
    }

    @PostMapping("/accounts/{accountId}/close")
    public AccountResponse closeAccount(@PathVariable("accountId") String accountId) {
        return AccountResponse.from(ledgerService.closeAccount(accountId));
    }

    @PostMapping("/tenants/{tenantId}/journal-entries")
    public ResponseEntity<JournalEntryResponse> postJournalEntry(
            @PathVariable("tenantId") String tenantId,
            @Valid @RequestBody PostJournalEntryRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received journal entry: tenant={}, lines={}, idempotencyKey={}",
                tenantId, request.getLines().size(), idempotencyKey);

        List<JournalLine> lines = request.getLines().stream().map(JournalLineRequest::toLine).toList();
        JournalEntry entry = ledgerService.postJournalEntry(tenantId, request.getDescription(), lines,
                idempotencyKey, request.getMetadata());

        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @GetMapping("/tenants/{tenantId}/journal-entries")
    public List<JournalEntryResponse> listJournalEntries(
            @PathVariable("tenantId") String tenantId,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ledgerService.getJournalEntries(tenantId, limit, offset).stream()
                .map(JournalEntryResponse::from)
                .toList();
    }

    @GetMapping("/journal-entries/{entryId}")
    public JournalEntryResponse getJournalEntry(@PathVariable("entryId") UUID entryId) {
        return JournalEntryResponse.from(ledgerService.getJournalEntry(entryId));
    }

    @PostMapping("/tenants/{tenantId}/holds")
    public ResponseEntity<HoldResponse> createHold(
            @PathVariable("tenantId") String tenantId,
            @Valid @RequestBody CreateHoldRequest request) {
        var hold = ledgerService.createHold(HoldRequest.builder()
                .tenantId(tenantId)
                .accountId(request.getAccountId())
                .amount(request.getAmount())
                .currency(CurrencyCode.parse(request.getCurrency()))
                .description(request.getDescription())
                .expiresAt(request.getExpiresAt())
                .metadata(request.getMetadata())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(HoldResponse.from(hold));
    }

    @GetMapping("/tenants/{tenantId}/holds")
    public List<HoldResponse> listHolds(
            @PathVariable("tenantId") String tenantId,
            @RequestParam(value = "status", required = false) HoldStatus status) {
        return ledgerService.getHolds(tenantId, status).stream().map(HoldResponse::from).toList();
    }

    @GetMapping("/holds/{holdId}")
    public HoldResponse getHold(@PathVariable("holdId") UUID holdId) {
        return HoldResponse.from(ledgerService.getHold(holdId));
    }

    @PostMapping("/holds/{holdId}/release")
    public HoldResponse releaseHold(@PathVariable("holdId") UUID holdId) {
        return HoldResponse.from(ledgerService.releaseHold(holdId));
    }
}
