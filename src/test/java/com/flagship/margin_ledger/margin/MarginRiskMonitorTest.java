package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.external.PriceUnavailableException;
import com.flagship.margin_ledger.ledger.LedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarginRiskMonitorTest {

    @Mock
    private MarginPositionService marginPositionService;

    @Mock
    private LedgerService ledgerService;

    @InjectMocks
    private MarginRiskMonitor monitor;

    @Test
    @DisplayName("A symbol without a price does not stop the tick")
    void missingPriceSkipsSymbol() {
        // Given
        when(marginPositionService.getOpenSymbols()).thenReturn(List.of("BTC/USDT", "ETH/USDT"));
        when(marginPositionService.markToMarket("BTC/USDT")).thenThrow(new PriceUnavailableException("BTC/USDT"));
        when(marginPositionService.markToMarket("ETH/USDT")).thenReturn(List.of());
        when(marginPositionService.checkLiquidations()).thenReturn(List.of());

        // When
        monitor.tick();

        // Then: the other symbol, the liquidation sweep and hold expiry still run
        verify(marginPositionService).markToMarket("ETH/USDT");
        verify(marginPositionService).checkLiquidations();
        verify(ledgerService).expireHolds();
    }
}
