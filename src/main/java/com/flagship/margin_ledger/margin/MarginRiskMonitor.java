package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic risk tick: revalues open positions, liquidates accounts at or below the
 * liquidation level and sweeps expired ledger holds.
 *
 * Enabled with {@code margin.monitor.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "margin.monitor.enabled", havingValue = "true")
public class MarginRiskMonitor {

    private final MarginPositionService marginPositionService;
    private final LedgerService ledgerService;

    @Scheduled(fixedRateString = "${margin.monitor.interval-ms:10000}")
    public void tick() {
        for (String symbol : marginPositionService.getOpenSymbols()) {
            try {
                List<MarginAccount> changed = marginPositionService.markToMarket(symbol);
                if (!changed.isEmpty()) {
                    log.info("Mark to market {}: {} accounts changed status", symbol, changed.size());
                }
            } catch (DomainException e) {
                log.warn("Mark to market skipped for {}: {}", symbol, e.getMessage());
            }
        }

        List<LiquidationEvent> events = marginPositionService.checkLiquidations();
        if (!events.isEmpty()) {
            log.warn("Liquidated {} positions", events.size());
        }

        ledgerService.expireHolds();
    }
}
