package com.swingtrading.risk;

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

import static com.swingtrading.Fixtures.START;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskGovernor Tests")
class RiskGovernorTest {

    private RiskGovernor governor;

    @BeforeEach
    void setUp() {
        governor = new RiskGovernor(100_000, 0.15, 5, 10);
    }

    private static ClosedTrade trade(LocalDate exitDate, double exitPrice) {
        Position position = Position.open("TCS", START, 100.0, 10, 0.0, 0.03, 0.12, 0.5, Map.of());
        return ClosedTrade.of(position, exitDate, exitPrice, ExitReason.MAX_HOLD, 0.0, MarketRegime.UNKNOWN);
    }

    private static ClosedTrade loss(LocalDate exitDate) {
        return trade(exitDate, 99.0);
    }

    private static ClosedTrade win(LocalDate exitDate) {
        return trade(exitDate, 101.0);
    }

    @Nested
    @DisplayName("Consecutive losses")
    class ConsecutiveLosses {

        @Test
        @DisplayName("Fifth straight loss suspends entries for the cooldown")
        void tripsAtLimit() {
            LocalDate day = START.plusDays(20);
            for (int i = 0; i < 4; i++) {
                governor.recordTrade(loss(day));
            }
            assertFalse(governor.isSuspended(day));

            governor.recordTrade(loss(day));

            assertTrue(governor.isSuspended(day));
            assertTrue(governor.isSuspended(day.plusDays(9)));
            assertEquals(day.plusDays(10), governor.getSuspendedUntil().orElseThrow());
            assertEquals(0, governor.getConsecutiveLosses(), "Trip consumes the streak");
            assertThat(governor.getTrips()).singleElement()
                .satisfies(trip -> {
                    assertEquals(BreakerType.CONSECUTIVE_LOSSES, trip.type());
                    assertEquals(5, trip.consecutiveLosses());
                });
        }

        @Test
        @DisplayName("A win resets the streak")
        void winResets() {
            LocalDate day = START.plusDays(20);
            for (int i = 0; i < 4; i++) {
                governor.recordTrade(loss(day));
            }
            governor.recordTrade(win(day));
            governor.recordTrade(loss(day));

            assertEquals(1, governor.getConsecutiveLosses());
            assertFalse(governor.isSuspended(day));
        }

        @Test
        @DisplayName("Suspension clears once the resume date is reached")
        void expires() {
            LocalDate day = START.plusDays(20);
            for (int i = 0; i < 5; i++) {
                governor.recordTrade(loss(day));
            }

            assertFalse(governor.isSuspended(day.plusDays(10)));
            assertTrue(governor.getSuspendedUntil().isEmpty());
        }

        @Test
        @DisplayName("A second trip during a pending suspension keeps the original resume date")
        void noExtension() {
            LocalDate first = START.plusDays(20);
            for (int i = 0; i < 5; i++) {
                governor.recordTrade(loss(first));
            }
            LocalDate second = first.plusDays(4);
            for (int i = 0; i < 5; i++) {
                governor.recordTrade(loss(second));
            }

            assertEquals(first.plusDays(10), governor.getSuspendedUntil().orElseThrow());
            assertEquals(2, governor.getTrips().size());
            assertEquals(first.plusDays(10), governor.getTrips().get(1).resumeDate());
            assertFalse(governor.isSuspended(first.plusDays(10)));
        }
    }

    @Nested
    @DisplayName("Drawdown")
    class Drawdown {

        @Test
        @DisplayName("Drawdown at the limit trips once, then disarms")
        void tripsAndDisarms() {
            governor.updateEquity(START, 120_000);
            governor.updateEquity(START.plusDays(1), 102_000);

            assertEquals(0.15, governor.getCurrentDrawdown(), 1e-9);
            assertTrue(governor.isSuspended(START.plusDays(1)));
            assertFalse(governor.isDrawdownArmed());

            governor.updateEquity(START.plusDays(12), 100_000);
            assertFalse(governor.isSuspended(START.plusDays(12)), "Deeper drawdown while disarmed never re-trips");
            assertEquals(1, governor.getTrips().size());
        }

        @Test
        @DisplayName("Recovery below the limit re-arms the breaker")
        void recoveryRearms() {
            governor.updateEquity(START, 100_000);
            governor.updateEquity(START.plusDays(1), 84_000);
            governor.updateEquity(START.plusDays(2), 90_000);

            assertTrue(governor.isDrawdownArmed());

            governor.updateEquity(START.plusDays(15), 80_000);
            assertEquals(2, governor.getTrips().size());
            assertEquals(START.plusDays(25), governor.getSuspendedUntil().orElseThrow());
        }

        @Test
        @DisplayName("A winning trade re-arms the breaker")
        void winRearms() {
            governor.updateEquity(START, 100_000);
            governor.updateEquity(START.plusDays(1), 80_000);
            assertFalse(governor.isDrawdownArmed());

            governor.recordTrade(win(START.plusDays(2)));

            assertTrue(governor.isDrawdownArmed());
        }

        @Test
        @DisplayName("Peak equity follows new highs only")
        void peak() {
            governor.updateEquity(START, 110_000);
            governor.updateEquity(START.plusDays(1), 105_000);

            assertEquals(110_000, governor.getPeakEquity(), 1e-9);
            assertEquals(5_000.0 / 110_000, governor.getCurrentDrawdown(), 1e-9);
        }
    }
}
