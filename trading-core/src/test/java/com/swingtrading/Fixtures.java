package com.swingtrading;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.model.Bar;
import com.swingtrading.model.PriceSeries;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Random;

/**
 * Shared builders for configurations and price data.
 */
public final class Fixtures {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private Fixtures() {
    }

    /**
     * Small-window configuration: 2/3 SMA, no regime filter, no strength floor.
     * Pairs of key/value overrides follow.
     */
    public static TradingConfig config(String... overrides) {
        Properties props = new Properties();
        props.setProperty("INITIAL_CAPITAL", "100000");
        props.setProperty("MAX_POSITIONS", "3");
        props.setProperty("STOP_LOSS_PERCENT", "3");
        props.setProperty("TAKE_PROFIT_PERCENT", "12");
        props.setProperty("TRAILING_STOP_PERCENT", "3");
        props.setProperty("MIN_HOLD_DAYS", "5");
        props.setProperty("MAX_HOLD_DAYS", "10");
        props.setProperty("MIN_SIGNAL_STRENGTH", "0");
        props.setProperty("REGIME_FILTER_ENABLED", "false");
        props.setProperty("REENTRY_COOLDOWN_DAYS", "10");
        props.setProperty("MAX_DRAWDOWN_PERCENT", "15");
        props.setProperty("MAX_CONSECUTIVE_LOSSES", "5");
        props.setProperty("CIRCUIT_BREAKER_COOLDOWN_DAYS", "10");
        props.setProperty("TRANSACTION_COST_PERCENT", "0.1");
        props.setProperty("STRATEGY", "MA_CROSSOVER");
        props.setProperty("MA_SHORT_PERIOD", "2");
        props.setProperty("MA_LONG_PERIOD", "3");
        props.setProperty("VOLUME_MA_PERIOD", "0");
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            props.setProperty(overrides[i], overrides[i + 1]);
        }
        return TradingConfig.forTest(props);
    }

    public static Bar bar(LocalDate date, double open, double high, double low, double close) {
        return new Bar(date, open, high, low, close, 1_000L);
    }

    /**
     * Flat bars: open = high = low = close.
     */
    public static PriceSeries series(String symbol, LocalDate start, double... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            bars.add(new Bar(start.plusDays(i), closes[i], closes[i], closes[i], closes[i], 1_000L));
        }
        return new PriceSeries(symbol, bars);
    }

    /**
     * Three flat bars at 10 then a jump: with 2/3 SMAs the fast average crosses
     * above the slow one on the fourth bar. Bigger jumps give stronger signals.
     * The price then stays at the new level for {@code holdBars} bars.
     */
    public static double[] goldenCross(double jump, int holdBars) {
        double[] closes = new double[4 + holdBars];
        closes[0] = 10;
        closes[1] = 10;
        closes[2] = 10;
        for (int i = 3; i < closes.length; i++) {
            closes[i] = 10 + jump;
        }
        return closes;
    }

    /**
     * Seeded random walk with intrabar range, for reproducibility checks.
     */
    public static PriceSeries randomWalk(String symbol, long seed, int days) {
        Random random = new Random(seed);
        List<Bar> bars = new ArrayList<>();
        double price = 100.0;
        for (int i = 0; i < days; i++) {
            double open = price;
            double close = Math.max(1.0, price * (1.0 + random.nextGaussian() * 0.02));
            double high = Math.max(open, close) * (1.0 + random.nextDouble() * 0.01);
            double low = Math.min(open, close) * (1.0 - random.nextDouble() * 0.01);
            long volume = 10_000L + random.nextInt(5_000);
            bars.add(new Bar(START.plusDays(i), open, high, low, close, volume));
            price = close;
        }
        return new PriceSeries(symbol, bars);
    }
}
