package com.flagship.margin_ledger.margin;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.flagship.margin_ledger.common.CurrencyCode.USDT;
import static org.junit.jupiter.api.Assertions.*;

class MarginCalculatorTest {

    private MarginCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new MarginCalculator(new MarginProperties());
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("Margin requirements")
    class Requirements {

        @Test
        @DisplayName("Initial margin is notional over leverage, rounded up")
        void initialMargin() {
            BigDecimal notional = calculator.notional(bd("1"), bd("30000"));

            assertEquals(0, calculator.initialMargin(notional, 10, USDT).compareTo(bd("3000")));
            assertEquals(0, calculator.initialMargin(bd("10"), 3, USDT).compareTo(bd("3.333334")));
        }

        @Test
        @DisplayName("Maintenance margin is a fixed share of initial margin")
        void maintenanceMargin() {
            assertEquals(0, calculator.maintenanceMargin(bd("3000"), USDT).compareTo(bd("300")));
        }
    }

    @Nested
    @DisplayName("Liquidation price")
    class LiquidationPrice {

        @Test
        @DisplayName("Long liquidation price sits below entry")
        void longBelowEntry() {
            BigDecimal price = calculator.liquidationPrice(PositionSide.LONG, bd("30000"), bd("1"), bd("3000"), bd("300"));

            assertEquals(0, price.compareTo(bd("27300")));
        }

        @Test
        @DisplayName("Short liquidation price sits above entry")
        void shortAboveEntry() {
            BigDecimal price = calculator.liquidationPrice(PositionSide.SHORT, bd("30000"), bd("1"), bd("3000"), bd("300"));

            assertEquals(0, price.compareTo(bd("32700")));
        }

        @Test
        @DisplayName("At the liquidation price, margin level equals the maintenance threshold")
        void levelAtLiquidationPrice() {
            // Given: a long of 2 at 1500, 5x leverage, equity equal to the initial margin
            BigDecimal initial = calculator.initialMargin(calculator.notional(bd("2"), bd("1500")), 5, USDT);
            BigDecimal maintenance = calculator.maintenanceMargin(initial, USDT);
            BigDecimal liquidation = calculator.liquidationPrice(PositionSide.LONG, bd("1500"), bd("2"), initial, maintenance);

            // When: marked at the liquidation price
            BigDecimal pnl = calculator.pnl(PositionSide.LONG, bd("1500"), liquidation, bd("2"), USDT);
            BigDecimal level = calculator.marginLevel(initial.add(pnl), initial);

            // Then
            assertEquals(0, level.compareTo(bd("10")));
            assertEquals(MarginAccountStatus.LIQUIDATION, calculator.statusFor(initial, level));
        }
    }

    @Nested
    @DisplayName("P&L and status")
    class PnlAndStatus {

        @Test
        @DisplayName("P&L is price move times size with the side's sign")
        void pnl() {
            assertEquals(0, calculator.pnl(PositionSide.LONG, bd("30000"), bd("33000"), bd("1"), USDT).compareTo(bd("3000")));
            assertEquals(0, calculator.pnl(PositionSide.LONG, bd("30000"), bd("27000"), bd("1"), USDT).compareTo(bd("-3000")));
            assertEquals(0, calculator.pnl(PositionSide.SHORT, bd("30000"), bd("27000"), bd("1"), USDT).compareTo(bd("3000")));
        }

        @Test
        @DisplayName("Margin level is zero when nothing is used")
        void levelWithoutUsage() {
            assertEquals(0, calculator.marginLevel(bd("500"), BigDecimal.ZERO).signum());
            assertEquals(MarginAccountStatus.ACTIVE, calculator.statusFor(BigDecimal.ZERO, BigDecimal.ZERO));
        }

        @Test
        @DisplayName("Status follows the margin call and liquidation levels")
        void statusThresholds() {
            assertEquals(MarginAccountStatus.ACTIVE, calculator.statusFor(bd("100"), bd("50")));
            assertEquals(MarginAccountStatus.MARGIN_CALL, calculator.statusFor(bd("100"), bd("49.9999")));
            assertEquals(MarginAccountStatus.MARGIN_CALL, calculator.statusFor(bd("100"), bd("10.0001")));
            assertEquals(MarginAccountStatus.LIQUIDATION, calculator.statusFor(bd("100"), bd("10")));
        }
    }

    @Test
    @DisplayName("High risk scores reduce the allowed leverage")
    void effectiveLeverage() {
        assertEquals(10, calculator.effectiveMaxLeverage(10, 50));
        assertEquals(50, calculator.effectiveMaxLeverage(100, 0));
        assertEquals(5, calculator.effectiveMaxLeverage(10, 75));
        assertEquals(1, calculator.effectiveMaxLeverage(10, 100));
    }

    @Test
    @DisplayName("Penalty fee is the configured share of the liquidation value")
    void penaltyFee() {
        assertEquals(0, calculator.penaltyFee(bd("27300"), USDT).compareTo(bd("819")));
    }
}
