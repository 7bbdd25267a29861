package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.LockAcquisitionException;
import com.flagship.margin_ledger.common.ValidationException;
import com.flagship.margin_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.margin_ledger.ledger.exception.HoldNotFoundException;
import com.flagship.margin_ledger.ledger.exception.InsufficientAvailableBalanceException;
import com.flagship.margin_ledger.ledger.exception.JournalEntryNotFoundException;
import com.flagship.margin_ledger.ledger.exception.UnbalancedEntryException;
import com.flagship.margin_ledger.ledger.store.AccountStore;
import com.flagship.margin_ledger.ledger.store.HoldStore;
import com.flagship.margin_ledger.ledger.store.JournalEntryStore;
import com.flagship.margin_ledger.observability.CorrelationContext;
import com.flagship.margin_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Double-entry ledger: journal entries, balances and holds.
 *
 * This service enforces the core invariants:
 * 1. Every journal entry balances per currency (debits == credits, compared exactly)
 * 2. Journal entries are immutable once written
 * 3. availableBalance == balance - sum(active holds) on every account
 * 4. Accounts without overdraft never go negative
 * 5. A posting applies all of its lines or none
 *
 * Every mutation runs under the locks of the accounts it touches, inside one store
 * transaction that commits before the locks are released. All checks happen before
 * the first write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerService {

    static final int MAX_PAGE_SIZE = 500;

    private final AccountStore accountStore;
    private final JournalEntryStore journalEntryStore;
    private final HoldStore holdStore;
    private final AccountLockManager lockManager;
    private final TransactionOperations transactions;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    // ==================== Journal entries ====================

    public JournalEntry postJournalEntry(String tenantId, String description, List<JournalLine> lines,
                                         String idempotencyKey, Map<String, String> metadata) {
        return postJournalEntry(JournalEntryRequest.builder()
            .tenantId(tenantId)
            .description(description)
            .lines(lines == null ? List.of() : lines)
            .idempotencyKey(idempotencyKey)
            .metadata(metadata)
            .build());
    }

    /**
     * Posts a balanced journal entry.
     *
     * Accounts referenced for the first time are opened in the line's currency without
     * overdraft. A repeated idempotency key returns the entry stored the first time and
     * moves no money.
     *
     * @throws ValidationException malformed lines, currency mismatch, foreign or closed account
     * @throws UnbalancedEntryException debits differ from credits for a currency
     * @throws InsufficientAvailableBalanceException a non-overdraft account would go negative
     * @throws LockAcquisitionException an account lock could not be taken in time
     */
    public JournalEntry postJournalEntry(JournalEntryRequest request) {
        try {
            return metrics.timePosting(() -> doPostJournalEntry(request));
        } catch (DomainException e) {
            metrics.recordRejection(e.getCode());
            log.warn("Journal entry rejected: code={}, message={}", e.getCode(), e.getMessage());
            throw e;
        }
    }

    private JournalEntry doPostJournalEntry(JournalEntryRequest request) {
        List<JournalLine> lines = validateLines(request);
        requireBalanced(request);

        String tenantId = request.getTenantId();
        boolean idempotent = request.hasIdempotencyKey();
        if (idempotent) {
            Optional<JournalEntry> existing = idempotencyService.findExisting(tenantId, request.getIdempotencyKey());
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotent replay: key={}, entryId={}", request.getIdempotencyKey(), existing.get().getId());
                return existing.get();
            }
        }

        List<String> lockKeys = lines.stream()
            .map(JournalLine::getAccountId)
            .distinct()
            .map(AccountLockManager::accountKey)
            .collect(Collectors.toCollection(ArrayList::new));
        if (idempotent) {
            lockKeys.add(AccountLockManager.idempotencyKey(tenantId, request.getIdempotencyKey()));
        }

        Posting posting = lockManager.withLocks(lockKeys,
            () -> transactions.execute(status -> postUnderLock(request, lines)));

        if (posting.isReplay()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotent replay: key={}, entryId={}", request.getIdempotencyKey(), posting.getEntry().getId());
            return posting.getEntry();
        }

        JournalEntry entry = posting.getEntry();
        if (idempotent) {
            metrics.recordIdempotencyMiss();
            idempotencyService.remember(tenantId, request.getIdempotencyKey(), entry.getId());
        }
        lines.stream().map(JournalLine::getCurrency).distinct()
            .forEach(currency -> metrics.recordEntryPosted(currency.name()));
        metrics.recordHold("expired", posting.getExpiredHolds());

        log.info("Journal entry posted: id={}, tenant={}, lines={}", entry.getId(), tenantId, lines.size());
        return entry;
    }

    private Posting postUnderLock(JournalEntryRequest request, List<JournalLine> lines) {
        String tenantId = request.getTenantId();
        if (request.hasIdempotencyKey()) {
            Optional<JournalEntry> prior = journalEntryStore.findByIdempotencyKey(tenantId, request.getIdempotencyKey());
            if (prior.isPresent()) {
                return new Posting(prior.get(), true, 0);
            }
        }

        Instant now = clock.instant();

        Map<String, CurrencyCode> currencies = new LinkedHashMap<>();
        Map<String, BigDecimal> netEffect = new LinkedHashMap<>();
        for (JournalLine line : lines) {
            CurrencyCode previous = currencies.putIfAbsent(line.getAccountId(), line.getCurrency());
            if (previous != null && previous != line.getCurrency()) {
                throw new ValidationException(String.format(
                    "Account %s is referenced with currencies %s and %s", line.getAccountId(), previous, line.getCurrency()));
            }
            netEffect.merge(line.getAccountId(), line.balanceEffect(), BigDecimal::add);
        }

        Map<String, Account> touched = new LinkedHashMap<>();
        Set<String> opened = new HashSet<>();
        for (Map.Entry<String, CurrencyCode> e : currencies.entrySet()) {
            String accountId = e.getKey();
            Optional<Account> existing = accountStore.findById(accountId);
            if (existing.isPresent()) {
                Account account = existing.get();
                requireUsable(account, tenantId);
                if (account.getCurrency() != e.getValue()) {
                    throw new ValidationException(String.format(
                        "Account %s is in %s, line is in %s", accountId, account.getCurrency(), e.getValue()));
                }
                touched.put(accountId, account);
            } else {
                touched.put(accountId, Account.open(accountId, tenantId, e.getValue(), false, now));
                opened.add(accountId);
            }
        }

        // checks first; nothing is written until every account passes
        Map<String, Account> updated = new LinkedHashMap<>();
        List<Hold> due = new ArrayList<>();
        for (Account account : touched.values()) {
            List<Hold> active = opened.contains(account.getId())
                ? List.of()
                : holdStore.findActiveByAccount(account.getId());
            BigDecimal held = BigDecimal.ZERO;
            for (Hold hold : active) {
                if (hold.isDue(now)) {
                    due.add(hold);
                } else {
                    held = held.add(hold.getAmount());
                }
            }

            BigDecimal net = netEffect.get(account.getId());
            BigDecimal balance = account.getBalance().add(net);
            BigDecimal available = balance.subtract(held);
            if (!account.isOverdraftAllowed() && available.signum() < 0) {
                throw new InsufficientAvailableBalanceException(
                    account.getId(), account.getBalance().subtract(held), net.negate());
            }
            updated.put(account.getId(), account.withBalances(balance, available, now));
        }

        for (Hold hold : due) {
            holdStore.update(hold.expire(now));
        }
        for (Account account : updated.values()) {
            if (opened.contains(account.getId())) {
                accountStore.insert(account);
            } else {
                accountStore.update(account);
            }
        }

        JournalEntry entry = new JournalEntry(
            UUID.randomUUID(),
            tenantId,
            request.getDescription(),
            lines,
            request.hasIdempotencyKey() ? request.getIdempotencyKey() : null,
            request.getMetadata(),
            now);
        journalEntryStore.insert(entry);
        return new Posting(entry, false, due.size());
    }

    private List<JournalLine> validateLines(JournalEntryRequest request) {
        ValidationException.requireNonNull(request, "request");
        ValidationException.requireText(request.getTenantId(), "tenantId");
        if (request.getLines() == null || request.getLines().isEmpty()) {
            throw new ValidationException("Journal entry must have at least one line");
        }

        List<JournalLine> normalized = new ArrayList<>(request.getLines().size());
        for (JournalLine line : request.getLines()) {
            ValidationException.requireNonNull(line, "line");
            ValidationException.requireText(line.getAccountId(), "line.accountId");
            ValidationException.requireNonNull(line.getCurrency(), "line.currency");
            ValidationException.requireNonNull(line.getDebit(), "line.debit");
            ValidationException.requireNonNull(line.getCredit(), "line.credit");
            if (line.getDebit().signum() < 0 || line.getCredit().signum() < 0) {
                throw new ValidationException("Line amounts must not be negative: account " + line.getAccountId());
            }
            if (line.isDebit() == line.isCredit()) {
                throw new ValidationException(
                    "Exactly one of debit or credit must be positive: account " + line.getAccountId());
            }
            CurrencyCode currency = line.getCurrency();
            if (!currency.fits(line.amount())) {
                throw new ValidationException(String.format("Amount %s has more than %d decimals for %s",
                    line.amount().toPlainString(), currency.minorUnits(), currency));
            }
            normalized.add(new JournalLine(line.getAccountId(), currency.normalize(line.getDebit()),
                currency.normalize(line.getCredit()), currency, line.getDescription()));
        }
        return normalized;
    }

    private void requireBalanced(JournalEntryRequest request) {
        Map<CurrencyCode, BigDecimal> debits = request.getDebitTotals();
        Map<CurrencyCode, BigDecimal> credits = request.getCreditTotals();
        Set<CurrencyCode> currencies = EnumSet.noneOf(CurrencyCode.class);
        currencies.addAll(debits.keySet());
        currencies.addAll(credits.keySet());
        for (CurrencyCode currency : currencies) {
            BigDecimal debit = debits.getOrDefault(currency, BigDecimal.ZERO);
            BigDecimal credit = credits.getOrDefault(currency, BigDecimal.ZERO);
            if (debit.compareTo(credit) != 0) {
                throw new UnbalancedEntryException(currency, debit, credit);
            }
        }
    }

    public JournalEntry getJournalEntry(UUID entryId) {
        ValidationException.requireNonNull(entryId, "entryId");
        return journalEntryStore.findById(entryId)
            .orElseThrow(() -> new JournalEntryNotFoundException(entryId));
    }

    /**
     * Journal entries of a tenant, newest first.
     */
    public List<JournalEntry> getJournalEntries(String tenantId, int limit, int offset) {
        ValidationException.requireText(tenantId, "tenantId");
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        return journalEntryStore.findByTenant(tenantId, limit, offset);
    }

    // ==================== Holds ====================

    /**
     * Reserves {@code amount} of the account's available balance. Expired holds on the
     * account are swept first, so their amounts count as available again.
     */
    public Hold createHold(HoldRequest request) {
        ValidationException.requireNonNull(request, "request");
        ValidationException.requireText(request.getTenantId(), "tenantId");
        ValidationException.requireText(request.getAccountId(), "accountId");
        ValidationException.requireNonNull(request.getAmount(), "amount");
        ValidationException.requireNonNull(request.getCurrency(), "currency");
        if (request.getAmount().signum() <= 0) {
            throw new ValidationException("Hold amount must be positive");
        }
        if (!request.getCurrency().fits(request.getAmount())) {
            throw new ValidationException(String.format("Amount %s has more than %d decimals for %s",
                request.getAmount().toPlainString(), request.getCurrency().minorUnits(), request.getCurrency()));
        }
        if (request.getExpiresAt() != null && !request.getExpiresAt().isAfter(clock.instant())) {
            throw new ValidationException("Hold expiry must be in the future");
        }

        String accountId = request.getAccountId();
        return CorrelationContext.withMdc(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId, () -> {
            Hold hold = lockManager.withLock(AccountLockManager.accountKey(accountId),
                () -> transactions.execute(status -> createHoldUnderLock(request)));
            metrics.recordHold("created", 1);
            log.info("Hold created: id={}, account={}, amount={} {}",
                hold.getId(), accountId, hold.getAmount().toPlainString(), hold.getCurrency());
            return hold;
        });
    }

    private Hold createHoldUnderLock(HoldRequest request) {
        String accountId = request.getAccountId();
        Account account = accountStore.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        requireUsable(account, request.getTenantId());
        if (account.getCurrency() != request.getCurrency()) {
            throw new ValidationException(String.format(
                "Account %s is in %s, hold is in %s", accountId, account.getCurrency(), request.getCurrency()));
        }

        Instant now = clock.instant();
        Account swept = sweepExpired(account, now).getAccount();
        BigDecimal amount = request.getCurrency().normalize(request.getAmount());
        if (amount.compareTo(swept.getAvailableBalance()) > 0) {
            throw new InsufficientAvailableBalanceException(accountId, swept.getAvailableBalance(), amount);
        }

        Hold hold = Hold.create(UUID.randomUUID(), request.getTenantId(), accountId, amount,
            request.getCurrency(), request.getDescription(), request.getExpiresAt(), request.getMetadata(), now);
        holdStore.insert(hold);
        accountStore.update(swept.withBalances(swept.getBalance(), swept.getAvailableBalance().subtract(amount), now));
        return hold;
    }

    /**
     * Releases an ACTIVE hold and restores the account's available balance.
     *
     * @throws HoldNotFoundException the hold is unknown, already released, or has expired
     *         (an active hold found past its expiry is expired by this call)
     */
    public Hold releaseHold(UUID holdId) {
        ValidationException.requireNonNull(holdId, "holdId");
        Hold hold = holdStore.findById(holdId).orElseThrow(() -> new HoldNotFoundException(holdId));
        String accountId = hold.getAccountId();

        return CorrelationContext.withMdc(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId, () -> {
            Hold released = lockManager.withLock(AccountLockManager.accountKey(accountId), () -> {
                // the sweep commits on its own so an expired hold stays expired when the release fails
                transactions.executeWithoutResult(status ->
                    accountStore.findById(accountId).ifPresent(a -> sweepExpired(a, clock.instant())));
                return transactions.execute(status -> releaseUnderLock(holdId, accountId));
            });
            metrics.recordHold("released", 1);
            log.info("Hold released: id={}, account={}", holdId, accountId);
            return released;
        });
    }

    private Hold releaseUnderLock(UUID holdId, String accountId) {
        Hold current = holdStore.findById(holdId)
            .filter(Hold::isActive)
            .orElseThrow(() -> new HoldNotFoundException(holdId));
        Account account = accountStore.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));

        Instant now = clock.instant();
        Hold released = current.release(now);
        holdStore.update(released);
        accountStore.update(account.withBalances(account.getBalance(),
            account.getAvailableBalance().add(current.getAmount()), now));
        return released;
    }

    public Hold getHold(UUID holdId) {
        ValidationException.requireNonNull(holdId, "holdId");
        return holdStore.findById(holdId).orElseThrow(() -> new HoldNotFoundException(holdId));
    }

    public List<Hold> getHolds(String tenantId, HoldStatus status) {
        ValidationException.requireText(tenantId, "tenantId");
        return holdStore.findByTenant(tenantId, status);
    }

    /**
     * Expires every ACTIVE hold past its expiry, account by account.
     *
     * @return number of holds expired
     */
    public int expireHolds() {
        Set<String> accountIds = holdStore.findDue(clock.instant()).stream()
            .map(Hold::getAccountId)
            .collect(Collectors.toCollection(TreeSet::new));

        int expired = 0;
        for (String accountId : accountIds) {
            try {
                Integer count = lockManager.withLock(AccountLockManager.accountKey(accountId),
                    () -> transactions.execute(status -> accountStore.findById(accountId)
                        .map(a -> sweepExpired(a, clock.instant()).getExpired())
                        .orElse(0)));
                expired += count == null ? 0 : count;
            } catch (LockAcquisitionException e) {
                log.warn("Skipping hold expiry for account {} this round: {}", accountId, e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} holds across {} accounts", expired, accountIds.size());
        }
        return expired;
    }

    /**
     * Expires the account's due holds and recomputes its available balance.
     * Caller holds the account lock.
     */
    private Sweep sweepExpired(Account account, Instant now) {
        List<Hold> active = holdStore.findActiveByAccount(account.getId());
        List<Hold> due = active.stream().filter(h -> h.isDue(now)).toList();
        if (due.isEmpty()) {
            return new Sweep(account, 0);
        }

        BigDecimal held = BigDecimal.ZERO;
        for (Hold hold : active) {
            if (hold.isDue(now)) {
                holdStore.update(hold.expire(now));
            } else {
                held = held.add(hold.getAmount());
            }
        }
        Account updated = account.withBalances(account.getBalance(), account.getBalance().subtract(held), now);
        accountStore.update(updated);
        metrics.recordHold("expired", due.size());
        log.info("Expired {} holds on account {}", due.size(), account.getId());
        return new Sweep(updated, due.size());
    }

    // ==================== Accounts ====================

    /**
     * Opens an account explicitly. Repeating the call with the same definition returns
     * the existing account.
     *
     * @throws ValidationException an account with this id exists with another tenant,
     *         currency or overdraft setting
     */
    public Account openAccount(String tenantId, String accountId, CurrencyCode currency, boolean overdraftAllowed) {
        ValidationException.requireText(tenantId, "tenantId");
        ValidationException.requireText(accountId, "accountId");
        ValidationException.requireNonNull(currency, "currency");

        return lockManager.withLock(AccountLockManager.accountKey(accountId), () -> transactions.execute(status -> {
            Optional<Account> existing = accountStore.findById(accountId);
            if (existing.isPresent()) {
                Account account = existing.get();
                if (!account.getTenantId().equals(tenantId)
                    || account.getCurrency() != currency
                    || account.isOverdraftAllowed() != overdraftAllowed) {
                    throw new ValidationException("Account " + accountId + " already exists with a different definition");
                }
                return account;
            }
            Account account = Account.open(accountId, tenantId, currency, overdraftAllowed, clock.instant());
            accountStore.insert(account);
            log.info("Account opened: id={}, tenant={}, currency={}, overdraft={}",
                accountId, tenantId, currency, overdraftAllowed);
            return account;
        }));
    }

    /**
     * Soft-closes an account. Requires a zero balance and no active holds.
     */
    public Account closeAccount(String accountId) {
        ValidationException.requireText(accountId, "accountId");
        return lockManager.withLock(AccountLockManager.accountKey(accountId), () -> transactions.execute(status -> {
            Account account = accountStore.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
            if (account.isClosed()) {
                throw new ValidationException("Account " + accountId + " is already closed");
            }
            Instant now = clock.instant();
            Account swept = sweepExpired(account, now).getAccount();
            if (!holdStore.findActiveByAccount(accountId).isEmpty()) {
                throw new ValidationException("Account " + accountId + " has active holds");
            }
            if (swept.getBalance().signum() != 0) {
                throw new ValidationException("Account " + accountId + " has a non-zero balance");
            }
            Account closed = swept.close(now);
            accountStore.update(closed);
            log.info("Account closed: id={}", accountId);
            return closed;
        }));
    }

    public Account getAccount(String accountId) {
        ValidationException.requireText(accountId, "accountId");
        return accountStore.findById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    public List<Account> getAccounts(String tenantId) {
        ValidationException.requireText(tenantId, "tenantId");
        return accountStore.findByTenant(tenantId);
    }

    /**
     * Balance snapshot. Holds past their expiry are swept first.
     */
    public AccountBalance getAccountBalance(String accountId) {
        Account account = getAccount(accountId);
        Instant now = clock.instant();
        boolean anyDue = holdStore.findActiveByAccount(accountId).stream().anyMatch(h -> h.isDue(now));
        if (anyDue) {
            account = lockManager.withLock(AccountLockManager.accountKey(accountId), () -> transactions.execute(status ->
                sweepExpired(accountStore.findById(accountId)
                    .orElseThrow(() -> new AccountNotFoundException(accountId)), clock.instant()).getAccount()));
        }
        return AccountBalance.of(account);
    }

    private static void requireUsable(Account account, String tenantId) {
        if (!account.getTenantId().equals(tenantId)) {
            throw new ValidationException("Account " + account.getId() + " belongs to another tenant");
        }
        if (account.isClosed()) {
            throw new ValidationException("Account " + account.getId() + " is closed");
        }
    }

    @Value
    private static class Posting {
        JournalEntry entry;
        boolean replay;
        int expiredHolds;
    }

    @Value
    private static class Sweep {
        Account account;
        int expired;
    }
}
