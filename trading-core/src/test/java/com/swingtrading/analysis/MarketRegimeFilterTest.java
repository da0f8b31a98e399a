package com.swingtrading.analysis;

import com.swingtrading.Fixtures;
import com.swingtrading.model.MarketRegime;
import com.swingtrading.model.PriceSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.swingtrading.Fixtures.START;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MarketRegimeFilter Tests")
class MarketRegimeFilterTest {

    @Test
    @DisplayName("Disabled filter allows every date")
    void disabled() {
        assertTrue(MarketRegimeFilter.disabled().isTradeable(START));
        PriceSeries falling = Fixtures.series("NIFTY50", START, 20, 19, 18, 17);
        assertTrue(new MarketRegimeFilter(false, falling, 2).isTradeable(START.plusDays(3)));
    }

    @Test
    @DisplayName("Enabled filter without a benchmark allows every date")
    void noBenchmark() {
        assertTrue(new MarketRegimeFilter(true, null, 50).isTradeable(START));
    }

    @Test
    @DisplayName("Tradeable only while the benchmark closes above its moving average")
    void aboveAverage() {
        PriceSeries rising = Fixtures.series("NIFTY50", START, 10, 11, 12, 13);
        PriceSeries falling = Fixtures.series("NIFTY50", START, 20, 19, 18, 17);

        assertTrue(new MarketRegimeFilter(true, rising, 2).isTradeable(START.plusDays(3)));
        assertFalse(new MarketRegimeFilter(true, falling, 2).isTradeable(START.plusDays(3)));
    }

    @Test
    @DisplayName("Missing benchmark bar or short history blocks entries")
    void missingData() {
        PriceSeries rising = Fixtures.series("NIFTY50", START, 10, 11, 12, 13);
        var filter = new MarketRegimeFilter(true, rising, 3);

        assertFalse(filter.isTradeable(START.plusDays(1)), "Only two bars of history for a 3-bar MA");
        assertFalse(filter.isTradeable(START.plusDays(30)), "No benchmark bar that day");
    }

    @Test
    @DisplayName("Classification combines MA side with 20-bar momentum")
    void classify() {
        double[] up = new double[25];
        double[] down = new double[25];
        double[] flat = new double[25];
        for (int i = 0; i < 25; i++) {
            up[i] = 100 + i;
            down[i] = 200 - i;
            flat[i] = 100 + (i % 2 == 0 ? 0.1 : -0.1);
        }
        var date = START.plusDays(24);

        assertEquals(MarketRegime.BULL, new MarketRegimeFilter(true, Fixtures.series("N", START, up), 5).classify(date));
        assertEquals(MarketRegime.BEAR, new MarketRegimeFilter(true, Fixtures.series("N", START, down), 5).classify(date));
        assertEquals(MarketRegime.SIDEWAYS, new MarketRegimeFilter(true, Fixtures.series("N", START, flat), 5).classify(date));
        assertEquals(MarketRegime.UNKNOWN, new MarketRegimeFilter(true, Fixtures.series("N", START, up), 5).classify(START.plusDays(10)));
        assertEquals(MarketRegime.UNKNOWN, MarketRegimeFilter.disabled().classify(date));
    }
}
