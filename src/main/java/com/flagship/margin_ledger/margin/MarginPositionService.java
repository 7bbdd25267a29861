package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import com.flagship.margin_ledger.common.ValidationException;
import com.flagship.margin_ledger.external.PriceSource;
import com.flagship.margin_ledger.ledger.AccountBalance;
import com.flagship.margin_ledger.ledger.AccountLockManager;
import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldRequest;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalEntryRequest;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.LedgerService;
import com.flagship.margin_ledger.margin.exception.InsufficientMarginException;
import com.flagship.margin_ledger.margin.exception.InvalidLeverageException;
import com.flagship.margin_ledger.margin.exception.MarginAccountExistsException;
import com.flagship.margin_ledger.margin.exception.MarginAccountNotFoundException;
import com.flagship.margin_ledger.margin.exception.PositionAlreadyClosedException;
import com.flagship.margin_ledger.margin.exception.PositionNotFoundException;
import com.flagship.margin_ledger.margin.exception.RiskLimitExceededException;
import com.flagship.margin_ledger.margin.store.LiquidationEventStore;
import com.flagship.margin_ledger.margin.store.MarginAccountStore;
import com.flagship.margin_ledger.margin.store.MarginPositionStore;
import com.flagship.margin_ledger.margin.store.RiskLimitsStore;
import com.flagship.margin_ledger.observability.CorrelationContext;
import com.flagship.margin_ledger.observability.MarginMetrics;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Margin accounts, leveraged positions and liquidation.
 *
 * Money only moves through {@link LedgerService}:
 * - each margin account is backed by the ledger account {@code margin:{id}}
 * - deposits come from {@code {tenant}:funding:{ccy}}
 * - realized P&L is settled against {@code {tenant}:house-pnl:{ccy}}
 * - liquidation penalties go to {@code {tenant}:insurance:{ccy}}
 * - a position's initial margin is reserved by a ledger hold while it is open
 *
 * Mutations of one margin account run under its {@code margin:{id}} lock, taken before
 * any ledger lock. The ledger never takes margin locks, so the lock order is global.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarginPositionService {

    private final MarginAccountStore accountStore;
    private final MarginPositionStore positionStore;
    private final LiquidationEventStore liquidationEventStore;
    private final RiskLimitsStore riskLimitsStore;
    private final LedgerService ledgerService;
    private final PriceSource priceSource;
    private final MarginCalculator calculator;
    private final MarginProperties properties;
    private final AccountLockManager lockManager;
    private final MarginMetrics metrics;
    private final Clock clock;

    static String ownerKey(String userId, String tenantId, String brokerId) {
        return "owner:" + RiskLimits.key(userId, tenantId, brokerId);
    }

    static String systemAccountId(String tenantId, String kind, CurrencyCode currency) {
        return tenantId + ":" + kind + ":" + currency.name();
    }

    // ==================== Margin accounts ====================

    /**
     * Opens a margin account and its backing ledger account, optionally funded.
     *
     * @throws MarginAccountExistsException the (user, tenant, broker) already has an account
     */
    public MarginAccount createMarginAccount(String userId, String tenantId, String brokerId,
                                             MarginAccountType accountType, String symbol,
                                             BigDecimal initialDeposit) {
        requireOwner(userId, tenantId, brokerId);
        ValidationException.requireNonNull(accountType, "accountType");
        if (accountType == MarginAccountType.ISOLATED) {
            ValidationException.requireText(symbol, "symbol");
        }
        CurrencyCode currency = properties.getSettlementCurrency();
        if (initialDeposit != null && initialDeposit.signum() != 0) {
            requireAmount(initialDeposit, currency, "initialDeposit");
        }

        return lockManager.withLock(ownerKey(userId, tenantId, brokerId), () -> {
            accountStore.findByOwner(userId, tenantId, brokerId).ifPresent(existing -> {
                throw new MarginAccountExistsException(userId, tenantId, brokerId, existing.getId());
            });

            RiskLimits limits = riskLimitsFor(userId, tenantId, brokerId);
            String accountId = UUID.randomUUID().toString();
            String ledgerAccountId = MarginAccount.ledgerAccountIdFor(accountId);
            ledgerService.openAccount(tenantId, ledgerAccountId, currency, false);

            BigDecimal deposit = initialDeposit == null ? currency.zero() : currency.normalize(initialDeposit);
            if (deposit.signum() > 0) {
                postTransfer(tenantId, systemAccount(tenantId, "funding", currency), ledgerAccountId, deposit,
                    "Initial margin deposit", "margin-deposit:" + accountId + ":initial");
            }

            Instant now = clock.instant();
            MarginAccount account = MarginAccount.builder()
                .id(accountId)
                .userId(userId)
                .tenantId(tenantId)
                .brokerId(brokerId)
                .accountType(accountType)
                .symbol(accountType == MarginAccountType.ISOLATED ? symbol : null)
                .ledgerAccountId(ledgerAccountId)
                .currency(currency)
                .totalEquity(deposit)
                .usedMargin(currency.zero())
                .availableBalance(deposit)
                .marginLevel(calculator.marginLevel(deposit, BigDecimal.ZERO))
                .maxLeverage(Math.min(limits.getMaxLeverage(), properties.getMaxLeverageCap()))
                .riskScore(limits.getRiskScore())
                .status(MarginAccountStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();
            accountStore.insert(account);

            log.info("Margin account created: id={}, user={}, tenant={}, broker={}, type={}, deposit={}",
                accountId, userId, tenantId, brokerId, accountType, deposit.toPlainString());
            return account;
        });
    }

    public MarginAccount depositMargin(String accountId, BigDecimal amount) {
        ValidationException.requireText(accountId, "accountId");
        CurrencyCode currency = properties.getSettlementCurrency();
        requireAmount(amount, currency, "amount");

        return withAccountLock(accountId, () -> {
            MarginAccount account = requireAccount(accountId);
            if (account.getStatus() == MarginAccountStatus.CLOSED) {
                throw new ValidationException("Margin account " + accountId + " is closed");
            }
            postTransfer(account.getTenantId(), systemAccount(account.getTenantId(), "funding", currency),
                account.getLedgerAccountId(), currency.normalize(amount), "Margin deposit", null);
            MarginAccount updated = recompute(account);
            log.info("Margin deposited: account={}, amount={}", accountId, amount.toPlainString());
            return updated;
        });
    }

    /**
     * Withdraws free margin back to the tenant's funding account.
     *
     * @throws InsufficientMarginException amount exceeds the account's available balance
     */
    public MarginAccount withdrawMargin(String accountId, BigDecimal amount) {
        ValidationException.requireText(accountId, "accountId");
        CurrencyCode currency = properties.getSettlementCurrency();
        requireAmount(amount, currency, "amount");

        return withAccountLock(accountId, () -> {
            MarginAccount account = evaluate(requireAccount(accountId));
            BigDecimal normalized = currency.normalize(amount);
            if (normalized.compareTo(account.getAvailableBalance()) > 0) {
                metrics.recordRejection(ErrorKind.INSUFFICIENT_MARGIN.name());
                throw new InsufficientMarginException(normalized, account.getAvailableBalance());
            }
            postTransfer(account.getTenantId(), account.getLedgerAccountId(),
                systemAccount(account.getTenantId(), "funding", currency), normalized, "Margin withdrawal", null);
            MarginAccount updated = recompute(account);
            log.info("Margin withdrawn: account={}, amount={}", accountId, normalized.toPlainString());
            return updated;
        });
    }

    public MarginAccount suspendMarginAccount(String accountId) {
        return withAccountLock(accountId, () -> {
            MarginAccount account = requireAccount(accountId);
            if (account.getStatus() == MarginAccountStatus.CLOSED) {
                throw new ValidationException("Margin account " + accountId + " is closed");
            }
            MarginAccount suspended = account.withStatus(MarginAccountStatus.SUSPENDED, clock.instant());
            accountStore.update(suspended);
            metrics.recordStatusChange(MarginAccountStatus.SUSPENDED.name());
            log.info("Margin account suspended: id={}", accountId);
            return suspended;
        });
    }

    public MarginAccount reactivateMarginAccount(String accountId) {
        return withAccountLock(accountId, () -> {
            MarginAccount account = requireAccount(accountId);
            if (account.getStatus() != MarginAccountStatus.SUSPENDED) {
                throw new ValidationException("Margin account " + accountId + " is not suspended");
            }
            MarginAccount reactivated = recompute(account.withStatus(MarginAccountStatus.ACTIVE, clock.instant()));
            log.info("Margin account reactivated: id={}, status={}", accountId, reactivated.getStatus());
            return reactivated;
        });
    }

    /**
     * Closes a margin account for good. Requires no open positions.
     */
    public MarginAccount closeMarginAccount(String accountId) {
        return withAccountLock(accountId, () -> {
            MarginAccount account = requireAccount(accountId);
            if (account.getStatus() == MarginAccountStatus.CLOSED) {
                throw new ValidationException("Margin account " + accountId + " is already closed");
            }
            if (!positionStore.findByAccount(accountId, PositionStatus.OPEN).isEmpty()) {
                throw new ValidationException("Margin account " + accountId + " has open positions");
            }
            MarginAccount closed = account.withStatus(MarginAccountStatus.CLOSED, clock.instant());
            accountStore.update(closed);
            metrics.recordStatusChange(MarginAccountStatus.CLOSED.name());
            log.info("Margin account closed: id={}", accountId);
            return closed;
        });
    }

    // ==================== Positions ====================

    /**
     * Opens a position and reserves its initial margin on the backing ledger account.
     *
     * @throws MarginAccountNotFoundException unknown account or not owned by the caller
     * @throws InvalidLeverageException leverage outside 1..effective maximum
     * @throws RiskLimitExceededException too many open positions or notional above the limit
     * @throws InsufficientMarginException initial margin above the available balance
     */
    public MarginPosition createMarginPosition(PositionRequest request) {
        ValidationException.requireNonNull(request, "request");
        requireOwner(request.getUserId(), request.getTenantId(), request.getBrokerId());
        ValidationException.requireText(request.getAccountId(), "accountId");
        ValidationException.requireText(request.getSymbol(), "symbol");
        ValidationException.requireNonNull(request.getSide(), "side");
        ValidationException.requireNonNull(request.getSize(), "size");
        if (request.getSize().signum() <= 0) {
            throw new ValidationException("Position size must be positive");
        }
        OrderType orderType = request.getOrderType() == null ? OrderType.MARKET : request.getOrderType();
        if (orderType == OrderType.LIMIT && request.getPrice() == null) {
            throw new ValidationException("LIMIT orders require a price");
        }
        if (request.getPrice() != null && request.getPrice().signum() <= 0) {
            throw new ValidationException("Price must be positive");
        }

        try {
            return metrics.time("open", () -> withAccountLock(request.getAccountId(),
                () -> openUnderLock(request, orderType)));
        } catch (DomainException e) {
            metrics.recordRejection(e.getCode());
            throw e;
        }
    }

    private MarginPosition openUnderLock(PositionRequest request, OrderType orderType) {
        MarginAccount account = accountStore.findById(request.getAccountId())
            .filter(a -> a.isOwnedBy(request.getUserId(), request.getTenantId(), request.getBrokerId()))
            .orElseThrow(() -> new MarginAccountNotFoundException(request.getAccountId()));
        if (account.getStatus() != MarginAccountStatus.ACTIVE) {
            throw new ValidationException("Margin account " + account.getId() + " is " + account.getStatus());
        }
        if (account.getAccountType() == MarginAccountType.ISOLATED && !request.getSymbol().equals(account.getSymbol())) {
            throw new ValidationException(String.format(
                "Isolated margin account %s trades %s only", account.getId(), account.getSymbol()));
        }

        int maxLeverage = calculator.effectiveMaxLeverage(account.getMaxLeverage(), account.getRiskScore());
        if (request.getLeverage() < 1 || request.getLeverage() > maxLeverage) {
            throw new InvalidLeverageException(request.getLeverage(), maxLeverage);
        }

        RiskLimits limits = riskLimitsStore.find(account.getUserId(), account.getTenantId(), account.getBrokerId())
            .orElseGet(() -> defaultRiskLimits(account.getUserId(), account.getTenantId(), account.getBrokerId()));
        int openPositions = positionStore.findByAccount(account.getId(), PositionStatus.OPEN).size();
        if (openPositions + 1 > limits.getMaxOpenPositions()) {
            throw new RiskLimitExceededException(String.format(
                "Open position limit reached: %d of %d", openPositions, limits.getMaxOpenPositions()));
        }

        BigDecimal entryPrice = orderType == OrderType.LIMIT
            ? request.getPrice()
            : priceSource.getCurrentPrice(request.getSymbol());
        BigDecimal notional = calculator.notional(request.getSize(), entryPrice);
        if (notional.compareTo(limits.getMaxPositionNotional()) > 0) {
            throw new RiskLimitExceededException(String.format("Position notional %s exceeds limit %s",
                notional.toPlainString(), limits.getMaxPositionNotional().toPlainString()));
        }

        CurrencyCode currency = account.getCurrency();
        BigDecimal initialMargin = calculator.initialMargin(notional, request.getLeverage(), currency);
        MarginAccount current = evaluate(account);
        if (initialMargin.compareTo(current.getAvailableBalance()) > 0) {
            throw new InsufficientMarginException(initialMargin, current.getAvailableBalance());
        }
        BigDecimal maintenanceMargin = calculator.maintenanceMargin(initialMargin, currency);

        UUID positionId = UUID.randomUUID();
        Hold hold = ledgerService.createHold(HoldRequest.builder()
            .tenantId(account.getTenantId())
            .accountId(account.getLedgerAccountId())
            .amount(initialMargin)
            .currency(currency)
            .description("Initial margin for position " + positionId)
            .metadata(Map.of("positionId", positionId.toString()))
            .build());

        Instant now = clock.instant();
        MarginPosition position = MarginPosition.builder()
            .id(positionId)
            .accountId(account.getId())
            .userId(account.getUserId())
            .tenantId(account.getTenantId())
            .brokerId(account.getBrokerId())
            .symbol(request.getSymbol())
            .side(request.getSide())
            .orderType(orderType)
            .size(request.getSize())
            .entryPrice(entryPrice)
            .currentPrice(entryPrice)
            .leverage(request.getLeverage())
            .initialMargin(initialMargin)
            .maintenanceMargin(maintenanceMargin)
            .liquidationPrice(calculator.liquidationPrice(request.getSide(), entryPrice, request.getSize(),
                initialMargin, maintenanceMargin))
            .unrealizedPnl(currency.zero())
            .realizedPnl(currency.zero())
            .holdId(hold.getId())
            .status(PositionStatus.OPEN)
            .openedAt(now)
            .updatedAt(now)
            .build();
        positionStore.insert(position);
        recompute(account);

        metrics.recordPosition("opened", position.getSymbol());
        log.info("Position opened: id={}, account={}, {} {} {} @ {}, leverage={}, initialMargin={}",
            positionId, account.getId(), position.getSide(), position.getSize().toPlainString(),
            position.getSymbol(), entryPrice.toPlainString(), position.getLeverage(), initialMargin.toPlainString());
        return position;
    }

    /**
     * Closes an open position at the current mark price and settles its P&L.
     *
     * @throws PositionNotFoundException unknown position or not owned by the caller
     * @throws PositionAlreadyClosedException the position is not OPEN
     */
    public CloseResult closeMarginPosition(String userId, String tenantId, String brokerId, UUID positionId) {
        requireOwner(userId, tenantId, brokerId);
        ValidationException.requireNonNull(positionId, "positionId");
        MarginPosition position = positionStore.findById(positionId)
            .filter(p -> p.getUserId().equals(userId) && p.getTenantId().equals(tenantId)
                && p.getBrokerId().equals(brokerId))
            .orElseThrow(() -> new PositionNotFoundException(positionId));

        return CorrelationContext.withMdc(CorrelationContext.POSITION_ID_MDC_KEY, positionId.toString(),
            () -> metrics.time("close", () -> withAccountLock(position.getAccountId(), () -> {
                MarginPosition current = requireOpen(positionId);
                MarginAccount account = requireAccount(current.getAccountId());

                MarginPosition closing = current.markClosing(clock.instant());
                positionStore.update(closing);
                BigDecimal price = markPriceOrReopen(closing);
                BigDecimal pnl = calculator.pnl(current.getSide(), current.getEntryPrice(), price,
                    current.getSize(), account.getCurrency());

                Settlement settlement = releaseAndSettle(account, closing, pnl, BigDecimal.ZERO, "close");

                MarginPosition closed = closing.close(price, pnl, clock.instant());
                positionStore.update(closed);
                recompute(account);

                metrics.recordPosition("closed", closed.getSymbol());
                log.info("Position closed: id={}, price={}, realizedPnl={}, uncoveredLoss={}",
                    positionId, price.toPlainString(), pnl.toPlainString(), settlement.getUncoveredLoss().toPlainString());
                return new CloseResult(closed, pnl, settlement.getJournalEntryId(), settlement.getUncoveredLoss());
            })));
    }

    /**
     * Force-closes an open position at the mark price, charging the liquidation penalty
     * to the insurance fund in the same journal entry as the P&L.
     */
    public LiquidationEvent liquidatePosition(UUID positionId, LiquidationReason reason) {
        ValidationException.requireNonNull(positionId, "positionId");
        LiquidationReason effectiveReason = reason == null ? LiquidationReason.FORCED_LIQUIDATION : reason;
        MarginPosition position = positionStore.findById(positionId)
            .orElseThrow(() -> new PositionNotFoundException(positionId));

        return CorrelationContext.withMdc(CorrelationContext.POSITION_ID_MDC_KEY, positionId.toString(),
            () -> withAccountLock(position.getAccountId(), () -> {
                MarginPosition current = requireOpen(positionId);
                MarginAccount account = requireAccount(current.getAccountId());
                BigDecimal triggeringLevel = evaluate(account).getMarginLevel();
                Instant triggeredAt = clock.instant();

                MarginPosition closing = current.markClosing(triggeredAt);
                positionStore.update(closing);
                BigDecimal price = markPriceOrReopen(closing);

                CurrencyCode currency = account.getCurrency();
                BigDecimal pnl = calculator.pnl(current.getSide(), current.getEntryPrice(), price,
                    current.getSize(), currency);
                BigDecimal liquidationValue = currency.round(calculator.notional(current.getSize(), price));
                BigDecimal penaltyFee = calculator.penaltyFee(liquidationValue, currency);

                Settlement settlement = releaseAndSettle(account, closing, pnl, penaltyFee, "liquidation");

                Instant executedAt = clock.instant();
                MarginPosition liquidated = closing.liquidate(price, pnl, executedAt);
                positionStore.update(liquidated);

                LiquidationEvent event = LiquidationEvent.builder()
                    .id(UUID.randomUUID())
                    .positionId(positionId)
                    .accountId(account.getId())
                    .userId(account.getUserId())
                    .tenantId(account.getTenantId())
                    .brokerId(account.getBrokerId())
                    .symbol(current.getSymbol())
                    .liquidationPrice(price)
                    .liquidationAmount(current.getSize())
                    .liquidationValue(liquidationValue)
                    .realizedPnl(pnl)
                    .penaltyFee(settlement.getPenaltyCharged())
                    .remainingMargin(ledgerService.getAccountBalance(account.getLedgerAccountId()).getBalance())
                    .marginRatio(triggeringLevel)
                    .reason(effectiveReason)
                    .status(LiquidationEvent.Status.EXECUTED)
                    .journalEntryId(settlement.getJournalEntryId())
                    .triggeredAt(triggeredAt)
                    .executedAt(executedAt)
                    .build();
                liquidationEventStore.insert(event);
                recompute(account);

                metrics.recordPosition("liquidated", current.getSymbol());
                log.warn("Position liquidated: id={}, account={}, reason={}, price={}, realizedPnl={}, penalty={}",
                    positionId, account.getId(), effectiveReason, price.toPlainString(), pnl.toPlainString(),
                    settlement.getPenaltyCharged().toPlainString());
                return event;
            }));
    }

    /**
     * Revalues every open position in {@code symbol} at the current mark price.
     *
     * @return accounts whose status changed
     */
    public List<MarginAccount> markToMarket(String symbol) {
        ValidationException.requireText(symbol, "symbol");
        BigDecimal price = priceSource.getCurrentPrice(symbol);
        Map<String, List<MarginPosition>> byAccount = positionStore.findOpenBySymbol(symbol).stream()
            .collect(Collectors.groupingBy(MarginPosition::getAccountId, LinkedHashMap::new, Collectors.toList()));

        List<MarginAccount> changed = new ArrayList<>();
        for (String accountId : byAccount.keySet()) {
            MarginAccount updated = withAccountLock(accountId, () -> {
                MarginAccount account = requireAccount(accountId);
                Instant now = clock.instant();
                for (MarginPosition position : positionStore.findByAccount(accountId, PositionStatus.OPEN)) {
                    if (position.getSymbol().equals(symbol)) {
                        BigDecimal pnl = calculator.pnl(position.getSide(), position.getEntryPrice(), price,
                            position.getSize(), account.getCurrency());
                        positionStore.update(position.mark(price, pnl, now));
                    }
                }
                MarginAccount recomputed = recompute(account);
                return recomputed.getStatus() != account.getStatus() ? recomputed : null;
            });
            if (updated != null) {
                changed.add(updated);
            }
        }
        log.debug("Marked {} accounts to market for {} @ {}", byAccount.size(), symbol, price.toPlainString());
        return changed;
    }

    /**
     * Liquidates every open position of every account in LIQUIDATION status.
     * Positions whose liquidation hits a retryable failure are left for the next run.
     */
    public List<LiquidationEvent> checkLiquidations() {
        List<LiquidationEvent> events = new ArrayList<>();
        for (MarginAccount account : accountStore.findByStatus(MarginAccountStatus.LIQUIDATION)) {
            for (MarginPosition position : positionStore.findByAccount(account.getId(), PositionStatus.OPEN)) {
                try {
                    events.add(liquidatePosition(position.getId(), LiquidationReason.FORCED_LIQUIDATION));
                } catch (PositionAlreadyClosedException e) {
                    log.debug("Position {} closed before liquidation", position.getId());
                } catch (DomainException e) {
                    if (e.getKind() != ErrorKind.RETRYABLE) {
                        throw e;
                    }
                    log.warn("Liquidation of position {} deferred: {}", position.getId(), e.getMessage());
                }
            }
        }
        return events;
    }

    // ==================== Risk ====================

    public RiskLimits getRiskLimits(String userId, String tenantId, String brokerId) {
        requireOwner(userId, tenantId, brokerId);
        return lockManager.withLock(ownerKey(userId, tenantId, brokerId),
            () -> riskLimitsFor(userId, tenantId, brokerId));
    }

    /**
     * Stores a new risk score (0..100) on the user's limits and margin account.
     * Scores above 50 reduce the leverage allowed for new positions.
     */
    public RiskLimits updateUserRiskScore(String userId, String tenantId, String brokerId, int riskScore) {
        requireOwner(userId, tenantId, brokerId);
        if (riskScore < 0 || riskScore > 100) {
            throw new ValidationException("Risk score must be between 0 and 100");
        }

        return lockManager.withLock(ownerKey(userId, tenantId, brokerId), () -> {
            Instant now = clock.instant();
            RiskLimits updated = riskLimitsFor(userId, tenantId, brokerId).toBuilder()
                .riskScore(riskScore)
                .updatedAt(now)
                .build();
            riskLimitsStore.save(updated);

            accountStore.findByOwner(userId, tenantId, brokerId).ifPresent(account ->
                withAccountLock(account.getId(), () -> {
                    MarginAccount current = requireAccount(account.getId());
                    accountStore.update(current.toBuilder().riskScore(riskScore).updatedAt(now).build());
                    return null;
                }));

            log.info("Risk score updated: user={}, tenant={}, broker={}, score={}", userId, tenantId, brokerId, riskScore);
            return updated;
        });
    }

    // ==================== Reads ====================

    public MarginAccount getMarginAccount(String accountId) {
        ValidationException.requireText(accountId, "accountId");
        return requireAccount(accountId);
    }

    public MarginAccount getUserMarginAccount(String userId, String tenantId, String brokerId) {
        requireOwner(userId, tenantId, brokerId);
        return accountStore.findByOwner(userId, tenantId, brokerId)
            .orElseThrow(() -> new MarginAccountNotFoundException(RiskLimits.key(userId, tenantId, brokerId)));
    }

    public List<MarginPosition> getPositions(String accountId, PositionStatus status) {
        requireAccount(accountId);
        return positionStore.findByAccount(accountId, status);
    }

    public MarginPosition getPosition(UUID positionId) {
        ValidationException.requireNonNull(positionId, "positionId");
        return positionStore.findById(positionId).orElseThrow(() -> new PositionNotFoundException(positionId));
    }

    public List<LiquidationEvent> getLiquidations(String accountId) {
        requireAccount(accountId);
        return liquidationEventStore.findByAccount(accountId);
    }

    public List<String> getOpenSymbols() {
        return new ArrayList<>(positionStore.findOpenSymbols());
    }

    // ==================== Internals ====================

    private <T> T withAccountLock(String accountId, Supplier<T> action) {
        return CorrelationContext.withMdc(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId,
            () -> lockManager.withLock(AccountLockManager.marginKey(accountId), action));
    }

    private MarginAccount requireAccount(String accountId) {
        return accountStore.findById(accountId).orElseThrow(() -> new MarginAccountNotFoundException(accountId));
    }

    private MarginPosition requireOpen(UUID positionId) {
        MarginPosition current = positionStore.findById(positionId)
            .orElseThrow(() -> new PositionNotFoundException(positionId));
        if (!current.isOpen()) {
            throw new PositionAlreadyClosedException(positionId, current.getStatus());
        }
        return current;
    }

    private BigDecimal markPriceOrReopen(MarginPosition closing) {
        try {
            return priceSource.getCurrentPrice(closing.getSymbol());
        } catch (RuntimeException e) {
            positionStore.update(closing.reopen(clock.instant()));
            log.warn("Price unavailable for {}, position {} returned to OPEN", closing.getSymbol(), closing.getId());
            throw e;
        }
    }

    /**
     * Releases the position's margin hold and posts its P&L (and penalty) in one entry.
     *
     * Losses and the penalty are capped by what the margin ledger account has available
     * once the hold is gone; the remainder of a loss is reported as uncovered. If the
     * release fails, the position returns to OPEN with its hold untouched. If the
     * posting fails, the margin is reserved again and the position returns to OPEN.
     */
    private Settlement releaseAndSettle(MarginAccount account, MarginPosition closing,
                                        BigDecimal pnl, BigDecimal penaltyFee, String purpose) {
        try {
            ledgerService.releaseHold(closing.getHoldId());
        } catch (RuntimeException e) {
            positionStore.update(closing.reopen(clock.instant()));
            log.warn("Releasing margin of position {} failed, position returned to OPEN: {}",
                closing.getId(), e.getMessage());
            throw e;
        }
        try {
            return settle(account, closing, pnl, penaltyFee, purpose);
        } catch (RuntimeException e) {
            restoreAfterFailedSettlement(account, closing, e);
            throw e;
        }
    }

    private Settlement settle(MarginAccount account, MarginPosition position,
                              BigDecimal pnl, BigDecimal penaltyFee, String purpose) {
        CurrencyCode currency = account.getCurrency();
        String tenantId = account.getTenantId();
        String marginLedgerId = account.getLedgerAccountId();
        AccountBalance balance = ledgerService.getAccountBalance(marginLedgerId);
        BigDecimal available = balance.getAvailableBalance().max(BigDecimal.ZERO);

        List<JournalLine> lines = new ArrayList<>();
        BigDecimal uncovered = currency.zero();
        BigDecimal remaining = available;
        if (pnl.signum() > 0) {
            String house = systemAccount(tenantId, "house-pnl", currency);
            lines.add(JournalLine.debit(house, pnl, currency, "Realized profit"));
            lines.add(JournalLine.credit(marginLedgerId, pnl, currency, "Realized profit"));
            remaining = remaining.add(pnl);
        } else if (pnl.signum() < 0) {
            BigDecimal loss = pnl.negate();
            BigDecimal covered = loss.min(available);
            uncovered = loss.subtract(covered);
            if (covered.signum() > 0) {
                String house = systemAccount(tenantId, "house-pnl", currency);
                lines.add(JournalLine.debit(marginLedgerId, covered, currency, "Realized loss"));
                lines.add(JournalLine.credit(house, covered, currency, "Realized loss"));
            }
            remaining = remaining.subtract(covered);
        }

        BigDecimal penalty = penaltyFee.min(remaining).max(BigDecimal.ZERO);
        if (penalty.signum() > 0) {
            String insurance = systemAccount(tenantId, "insurance", currency);
            lines.add(JournalLine.debit(marginLedgerId, penalty, currency, "Liquidation penalty"));
            lines.add(JournalLine.credit(insurance, penalty, currency, "Liquidation penalty"));
        }

        if (uncovered.signum() > 0) {
            log.warn("Uncovered loss on position {}: {} {}", position.getId(), uncovered.toPlainString(), currency);
        }
        if (lines.isEmpty()) {
            return new Settlement(null, uncovered, currency.zero());
        }

        JournalEntry entry = ledgerService.postJournalEntry(JournalEntryRequest.builder()
            .tenantId(tenantId)
            .description("Position " + purpose + " " + position.getId())
            .lines(lines)
            .idempotencyKey("position-" + purpose + ":" + position.getId())
            .metadata(Map.of("positionId", position.getId().toString(), "marginAccountId", account.getId()))
            .build());
        return new Settlement(entry.getId(), uncovered, currency.normalize(penalty));
    }

    private void restoreAfterFailedSettlement(MarginAccount account, MarginPosition closing, RuntimeException cause) {
        try {
            Hold hold = ledgerService.createHold(HoldRequest.builder()
                .tenantId(account.getTenantId())
                .accountId(account.getLedgerAccountId())
                .amount(closing.getInitialMargin())
                .currency(account.getCurrency())
                .description("Initial margin for position " + closing.getId())
                .metadata(Map.of("positionId", closing.getId().toString()))
                .build());
            positionStore.update(closing.reopen(clock.instant()).toBuilder().holdId(hold.getId()).build());
            log.warn("Settlement of position {} failed, position returned to OPEN: {}", closing.getId(), cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Settlement of position {} failed and its margin could not be reserved again; "
                + "position left in CLOSING", closing.getId(), e);
        }
    }

    /**
     * Stored limits of the owner, saving the defaults on first use. Callers hold the owner lock.
     */
    private RiskLimits riskLimitsFor(String userId, String tenantId, String brokerId) {
        return riskLimitsStore.find(userId, tenantId, brokerId).orElseGet(() -> {
            RiskLimits defaults = defaultRiskLimits(userId, tenantId, brokerId);
            riskLimitsStore.save(defaults);
            return defaults;
        });
    }

    private RiskLimits defaultRiskLimits(String userId, String tenantId, String brokerId) {
        Instant now = clock.instant();
        return RiskLimits.builder()
            .userId(userId)
            .tenantId(tenantId)
            .brokerId(brokerId)
            .maxLeverage(Math.min(properties.getDefaultMaxLeverage(), properties.getMaxLeverageCap()))
            .maxPositionNotional(properties.getDefaultMaxPositionNotional())
            .maxOpenPositions(properties.getDefaultMaxOpenPositions())
            .riskScore(0)
            .riskTier(RiskTier.MEDIUM)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Account figures recomputed from its ledger balance and open positions, without saving.
     */
    private MarginAccount evaluate(MarginAccount account) {
        CurrencyCode currency = account.getCurrency();
        AccountBalance balance = ledgerService.getAccountBalance(account.getLedgerAccountId());
        BigDecimal unrealized = currency.zero();
        BigDecimal used = currency.zero();
        for (MarginPosition position : positionStore.findByAccount(account.getId(), PositionStatus.OPEN)) {
            unrealized = unrealized.add(position.getUnrealizedPnl());
            used = used.add(position.getInitialMargin());
        }

        BigDecimal equity = balance.getBalance().add(unrealized);
        BigDecimal available = balance.getAvailableBalance().min(equity.subtract(used)).max(BigDecimal.ZERO);
        BigDecimal level = calculator.marginLevel(equity, used);
        MarginAccountStatus status = account.getStatus().isAdministrative()
            ? account.getStatus()
            : calculator.statusFor(used, level);

        return account.toBuilder()
            .totalEquity(currency.round(equity))
            .usedMargin(currency.round(used))
            .availableBalance(currency.round(available))
            .marginLevel(level)
            .status(status)
            .updatedAt(clock.instant())
            .build();
    }

    private MarginAccount recompute(MarginAccount account) {
        MarginAccount updated = evaluate(account);
        accountStore.update(updated);
        if (updated.getStatus() != account.getStatus()) {
            metrics.recordStatusChange(updated.getStatus().name());
            if (updated.getStatus() == MarginAccountStatus.ACTIVE) {
                log.info("Margin account {} back to ACTIVE, marginLevel={}", account.getId(), updated.getMarginLevel());
            } else {
                log.warn("Margin account {} moved to {}, marginLevel={}",
                    account.getId(), updated.getStatus(), updated.getMarginLevel());
            }
        }
        return updated;
    }

    private String systemAccount(String tenantId, String kind, CurrencyCode currency) {
        String id = systemAccountId(tenantId, kind, currency);
        ledgerService.openAccount(tenantId, id, currency, true);
        return id;
    }

    private void postTransfer(String tenantId, String fromAccountId, String toAccountId, BigDecimal amount,
                              String description, String idempotencyKey) {
        CurrencyCode currency = properties.getSettlementCurrency();
        ledgerService.postJournalEntry(JournalEntryRequest.builder()
            .tenantId(tenantId)
            .description(description)
            .line(JournalLine.debit(fromAccountId, amount, currency, description))
            .line(JournalLine.credit(toAccountId, amount, currency, description))
            .idempotencyKey(idempotencyKey)
            .build());
    }

    private static void requireOwner(String userId, String tenantId, String brokerId) {
        ValidationException.requireText(userId, "userId");
        ValidationException.requireText(tenantId, "tenantId");
        ValidationException.requireText(brokerId, "brokerId");
    }

    private static void requireAmount(BigDecimal amount, CurrencyCode currency, String field) {
        ValidationException.requireNonNull(amount, field);
        if (amount.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
        if (!currency.fits(amount)) {
            throw new ValidationException(String.format("%s has more than %d decimals for %s",
                field, currency.minorUnits(), currency));
        }
    }

    @Value
    private static class Settlement {
        UUID journalEntryId;
        BigDecimal uncoveredLoss;
        BigDecimal penaltyCharged;
    }
}
