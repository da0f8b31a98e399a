package com.swingtrading.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Position Tests")
class PositionTest {

    private static final LocalDate ENTRY = LocalDate.of(2024, 3, 1);
    private static final double DELTA = 1e-9;

    private Position open() {
        return Position.open("TCS", ENTRY, 100.0, 10, 0.001, 0.03, 0.12, 0.5, Map.of("ma_fast", 99.0));
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Stop, target and committed capital derive from the entry")
        void derivedLevels() {
            Position position = open();

            assertEquals(97.0, position.stopLossPrice(), DELTA);
            assertEquals(112.0, position.takeProfitPrice(), DELTA);
            assertEquals(1.0, position.entryFee(), DELTA);
            assertEquals(1001.0, position.capitalCommitted(), DELTA);
            assertEquals(100.0, position.highestPrice(), DELTA);
            assertTrue(position.isOpen());
        }

        @Test
        @DisplayName("Should reject zero quantity")
        void rejectsZeroQuantity() {
            assertThrows(IllegalArgumentException.class,
                () -> Position.open("TCS", ENTRY, 100.0, 0, 0.001, 0.03, 0.12, 0.5, Map.of()));
        }

        @Test
        @DisplayName("Should reject stop-loss at or above entry")
        void rejectsStopAboveEntry() {
            assertThrows(IllegalArgumentException.class,
                () -> new Position("TCS", ENTRY, 100.0, 1, 100, 0, 100.0, 110.0, 100.0, 0.5,
                    Map.of(), PositionStatus.OPEN));
        }
    }

    @Test
    @DisplayName("Highest price only ever rises")
    void highestPriceMonotonic() {
        Position position = open().withHighestPrice(105.0).withHighestPrice(103.0);

        assertEquals(105.0, position.highestPrice(), DELTA);
        assertEquals(105.0 * 0.97, position.trailingStopPrice(0.03), DELTA);
    }

    @Test
    @DisplayName("Days held counts calendar days")
    void daysHeld() {
        assertEquals(7, open().daysHeld(ENTRY.plusWeeks(1)));
    }

    @Test
    @DisplayName("Closed trade P&L includes both fees")
    void closedTradePnl() {
        ClosedTrade trade = ClosedTrade.of(open(), ENTRY.plusDays(3), 110.0, ExitReason.TAKE_PROFIT,
            0.001, MarketRegime.BULL);

        assertEquals(1100.0, trade.grossProceeds(), DELTA);
        assertEquals(1.1, trade.exitFee(), DELTA);
        assertEquals(1098.9 - 1001.0, trade.pnl(), DELTA);
        assertEquals(PositionStatus.CLOSED, trade.position().status());
        assertTrue(trade.isWin());
        assertEquals(3, trade.daysHeld());
    }

    @Test
    @DisplayName("Exit reasons expose the five report labels")
    void exitLabels() {
        assertEquals("Stop Loss", ExitReason.STOP_LOSS.label());
        assertEquals("Take Profit", ExitReason.TAKE_PROFIT.label());
        assertEquals("Trailing Stop", ExitReason.TRAILING_STOP.label());
        assertEquals("Death Cross", ExitReason.DEATH_CROSS.label());
        assertEquals("Max Hold Period", ExitReason.MAX_HOLD.label());
    }
}
