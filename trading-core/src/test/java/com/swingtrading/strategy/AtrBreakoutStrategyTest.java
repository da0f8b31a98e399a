package com.swingtrading.strategy;

import com.swingtrading.model.Bar;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.swingtrading.Fixtures.START;
import static com.swingtrading.Fixtures.bar;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AtrBreakoutStrategy Tests")
class AtrBreakoutStrategyTest {

    private final AtrBreakoutStrategy strategy = new AtrBreakoutStrategy(5, 5, 1.0);

    /** Six quiet bars (close 10, range 9.5-10.5, true range 1) followed by {@code tail}. */
    private IndicatorSeries quietThen(Bar... tail) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            bars.add(bar(START.plusDays(i), 10.0, 10.5, 9.5, 10.0));
        }
        bars.addAll(List.of(tail));
        return strategy.prepare(new PriceSeries("TCS", bars));
    }

    @Test
    @DisplayName("Signals when the close clears the prior high by one ATR")
    void breakout() {
        IndicatorSeries series = quietThen(
            bar(START.plusDays(6), 10.0, 12.2, 11.0, 12.0),
            bar(START.plusDays(7), 12.0, 12.2, 11.8, 12.0));

        assertFalse(strategy.signal(series, 5).signal());
        EntrySignal signal = strategy.signal(series, 6);
        assertTrue(signal.signal());
        // ATR (4 x 1.0 + 2.2) / 5 = 1.24, prior high 10.5
        assertEquals(1.24, series.value(AtrBreakoutStrategy.ATR, 6), 1e-9);
        assertEquals((12.0 - 10.5) / 1.24 / 3.0, signal.strength(), 1e-9);
        assertFalse(strategy.signal(series, 7).signal(), "The breakout bar raises the prior high");
    }

    @Test
    @DisplayName("A move inside the ATR buffer is not a breakout")
    void insideBuffer() {
        IndicatorSeries series = quietThen(bar(START.plusDays(6), 10.0, 11.4, 10.0, 11.3));

        assertFalse(strategy.signal(series, 6).signal());
    }

    @Test
    @DisplayName("Reversal when the close breaks below the prior low by one ATR")
    void breakdown() {
        IndicatorSeries series = quietThen(bar(START.plusDays(6), 10.0, 9.6, 6.9, 7.0));

        assertFalse(strategy.trendReversed(series, 5));
        assertTrue(strategy.trendReversed(series, 6));
    }
}
