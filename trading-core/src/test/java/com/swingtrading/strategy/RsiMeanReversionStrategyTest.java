package com.swingtrading.strategy;

import com.swingtrading.Fixtures;
import com.swingtrading.model.IndicatorSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.swingtrading.Fixtures.START;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RsiMeanReversionStrategy Tests")
class RsiMeanReversionStrategyTest {

    private final RsiMeanReversionStrategy strategy = new RsiMeanReversionStrategy(2, 30, 70);

    @Test
    @DisplayName("Signals when RSI first drops below oversold")
    void oversoldEntry() {
        // RSI(2): bar 2 = 50 (one up, one down), bar 3 = 0 (two drops)
        IndicatorSeries series = strategy.prepare(Fixtures.series("TCS", START, 10, 11, 10, 9, 8));

        assertFalse(strategy.signal(series, 2).signal());
        EntrySignal signal = strategy.signal(series, 3);
        assertTrue(signal.signal());
        assertThat(signal.strength()).isEqualTo(1.0);
        assertFalse(strategy.signal(series, 4).signal(), "Still oversold is not a new signal");
    }

    @Test
    @DisplayName("Reversal when RSI climbs above overbought")
    void overboughtReversal() {
        IndicatorSeries series = strategy.prepare(Fixtures.series("TCS", START, 10, 11, 10, 11, 12));

        assertTrue(strategy.trendReversed(series, 4));
    }
}
