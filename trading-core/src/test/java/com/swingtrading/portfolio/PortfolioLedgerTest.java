package com.swingtrading.portfolio;

import com.swingtrading.Fixtures;
import com.swingtrading.error.InsufficientCapitalException;
import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.ExitReason;
import com.swingtrading.model.MarketRegime;
import com.swingtrading.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static com.swingtrading.Fixtures.START;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PortfolioLedger Tests")
class PortfolioLedgerTest {

    private static final double DELTA = 1e-6;

    private PortfolioLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PortfolioLedger(Fixtures.config());
    }

    private void assertCapitalIdentity() {
        assertEquals(ledger.totalCapital(), ledger.getFreeCapital() + ledger.committedCapital(), DELTA,
            "free + committed must equal initial + realized");
    }

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("100,000 over 3 slots gives 33,333.33 per position")
        void capitalPerPosition() {
            assertEquals(33_333.33, ledger.capitalPerPosition(), 0.01);
        }

        @Test
        @DisplayName("Default sizing stays constant after a profitable close")
        void defaultSizingIgnoresRealizedProfit() {
            ledger.open("AAA", START, 100.0, 0.5, Map.of());
            ledger.close("AAA", START.plusDays(3), 111.0, ExitReason.TAKE_PROFIT, MarketRegime.UNKNOWN);

            assertThat(ledger.getRealizedPnl()).isPositive();
            assertEquals(33_333.33, ledger.capitalPerPosition(), 0.01);
            Position next = ledger.open("BBB", START.plusDays(3), 100.0, 0.5, Map.of()).orElseThrow();
            assertEquals(333, next.quantity());
            assertCapitalIdentity();
        }

        @Test
        @DisplayName("Quantity is whole shares with the entry fee included")
        void quantity() {
            assertEquals(333, ledger.quantityFor(100.0));
            Position position = ledger.open("TCS", START, 100.0, 0.5, Map.of()).orElseThrow();

            assertEquals(333, position.quantity());
            assertEquals(33_333.3, position.capitalCommitted(), DELTA);
            assertThat(position.capitalCommitted()).isLessThanOrEqualTo(ledger.capitalPerPosition());
            assertCapitalIdentity();
        }

        @Test
        @DisplayName("Fixed sizing ignores realized P&L; equity sizing follows it")
        void sizingModes() {
            var fixed = new PortfolioLedger(100_000, 2, SizingMode.FIXED_INITIAL, 0.0, 0.03, 0.12, 10);
            var equity = new PortfolioLedger(100_000, 2, SizingMode.REALIZED_EQUITY, 0.0, 0.03, 0.12, 10);
            for (PortfolioLedger l : new PortfolioLedger[]{fixed, equity}) {
                l.open("TCS", START, 100.0, 0.5, Map.of());
                l.close("TCS", START.plusDays(1), 110.0, ExitReason.TAKE_PROFIT, MarketRegime.UNKNOWN);
            }

            assertEquals(50_000.0, fixed.capitalPerPosition(), DELTA);
            assertEquals(52_500.0, equity.capitalPerPosition(), DELTA);
        }

        @Test
        @DisplayName("Entry is refused when free capital is below one allocation")
        void insufficientCapital() {
            var small = new PortfolioLedger(100_000, 2, SizingMode.FIXED_INITIAL, 0.0, 0.03, 0.12, 10);
            small.open("AAA", START, 100.0, 0.5, Map.of());
            small.close("AAA", START.plusDays(1), 90.0, ExitReason.STOP_LOSS, MarketRegime.UNKNOWN);
            small.open("BBB", START.plusDays(1), 100.0, 0.5, Map.of());

            var e = assertThrows(InsufficientCapitalException.class,
                () -> small.open("CCC", START.plusDays(1), 100.0, 0.5, Map.of()));
            assertEquals(50_000.0, e.getRequired(), DELTA);
            assertEquals(45_000.0, e.getAvailable(), DELTA);
            assertFalse(small.hasOpenPosition("CCC"));
        }

        @Test
        @DisplayName("A price above the whole allocation cannot buy a single share")
        void priceTooHigh() {
            assertThrows(InsufficientCapitalException.class,
                () -> ledger.open("MRF", START, 40_000.0, 0.5, Map.of()));
            assertEquals(100_000.0, ledger.getFreeCapital(), DELTA);
        }
    }

    @Nested
    @DisplayName("Slots")
    class Slots {

        @Test
        @DisplayName("Never more than max positions open")
        void maxPositions() {
            assertTrue(ledger.open("AAA", START, 100.0, 0.5, Map.of()).isPresent());
            assertTrue(ledger.open("BBB", START, 100.0, 0.5, Map.of()).isPresent());
            assertTrue(ledger.open("CCC", START, 100.0, 0.5, Map.of()).isPresent());

            assertEquals(Optional.empty(), ledger.open("DDD", START, 100.0, 0.5, Map.of()));
            assertEquals(3, ledger.openCount());
            assertFalse(ledger.hasFreeSlot());
        }

        @Test
        @DisplayName("An instrument never holds two positions")
        void noDuplicates() {
            ledger.open("AAA", START, 100.0, 0.5, Map.of());

            assertTrue(ledger.open("AAA", START.plusDays(1), 101.0, 0.9, Map.of()).isEmpty());
            assertEquals(1, ledger.openCount());
        }

        @Test
        @DisplayName("Open positions are listed by symbol")
        void sortedPositions() {
            ledger.open("CCC", START, 100.0, 0.5, Map.of());
            ledger.open("AAA", START, 100.0, 0.5, Map.of());

            assertThat(ledger.openPositions()).extracting(Position::symbol).containsExactly("AAA", "CCC");
        }
    }

    @Nested
    @DisplayName("Exits and cooldown")
    class Exits {

        @Test
        @DisplayName("Losing exit settles P&L and blocks re-entry for the cooldown window")
        void lossSetsCooldown() {
            ledger.open("TCS", START, 100.0, 0.5, Map.of());
            LocalDate exitDate = START.plusDays(3);

            ClosedTrade trade = ledger.close("TCS", exitDate, 97.0, ExitReason.STOP_LOSS, MarketRegime.UNKNOWN);

            assertTrue(trade.isLoss());
            assertEquals(trade.pnl(), ledger.getRealizedPnl(), DELTA);
            assertCapitalIdentity();
            assertTrue(ledger.isInCooldown("TCS", exitDate.plusDays(9)));
            assertFalse(ledger.isInCooldown("TCS", exitDate.plusDays(10)));
            assertTrue(ledger.open("TCS", exitDate.plusDays(5), 95.0, 0.9, Map.of()).isEmpty());
            assertTrue(ledger.open("TCS", exitDate.plusDays(10), 95.0, 0.9, Map.of()).isPresent());
        }

        @Test
        @DisplayName("Winning exit never sets a cooldown")
        void winNoCooldown() {
            ledger.open("TCS", START, 100.0, 0.5, Map.of());
            ledger.close("TCS", START.plusDays(3), 112.0, ExitReason.TAKE_PROFIT, MarketRegime.BULL);

            assertTrue(ledger.getCooldownUntil("TCS").isEmpty());
            assertFalse(ledger.isInCooldown("TCS", START.plusDays(4)));
            assertCapitalIdentity();
        }

        @Test
        @DisplayName("Closing an instrument without a position is an error")
        void closeUnknown() {
            assertThrows(IllegalStateException.class,
                () -> ledger.close("NONE", START, 10.0, ExitReason.MAX_HOLD, MarketRegime.UNKNOWN));
        }

        @Test
        @DisplayName("Reverting an entry returns the committed capital in full")
        void revert() {
            ledger.open("TCS", START, 100.0, 0.5, Map.of());
            ledger.revertEntry("TCS");

            assertEquals(100_000.0, ledger.getFreeCapital(), DELTA);
            assertEquals(0, ledger.openCount());
            assertTrue(ledger.closedTrades().isEmpty());
        }

        @Test
        @DisplayName("Restored positions take a slot and their capital")
        void restore() {
            Position saved = Position.open("INFY", START, 50.0, 100, 0.001, 0.03, 0.12, 0.4, Map.of());
            ledger.restore(saved);

            assertTrue(ledger.hasOpenPosition("INFY"));
            assertCapitalIdentity();
            assertThrows(IllegalStateException.class, () -> ledger.restore(saved));
        }
    }

    @Test
    @DisplayName("Mark-to-market values positions at their latest price")
    void totalValue() {
        ledger.open("TCS", START, 100.0, 0.5, Map.of());
        double free = ledger.getFreeCapital();

        assertEquals(free + 333 * 105.0, ledger.totalValue(Map.of("TCS", 105.0)), DELTA);
        assertEquals(free + 333 * 100.0, ledger.totalValue(Map.of()), DELTA);
    }
}
