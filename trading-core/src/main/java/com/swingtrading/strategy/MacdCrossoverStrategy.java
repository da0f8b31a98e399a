package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moving Average Convergence Divergence (MACD) crossover:
 * - Buy when the histogram crosses ABOVE zero (MACD over its signal line)
 * - Reversal when the histogram crosses BELOW zero
 */
public final class MacdCrossoverStrategy implements TradingStrategy {
    public static final String MACD = "MACD";
    public static final String MACD_SIGNAL = "MACD_SIGNAL";
    public static final String MACD_HIST = "MACD_HIST";

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MacdCrossoverStrategy(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    public MacdCrossoverStrategy(TradingConfig config) {
        this(config.getMacdFast(), config.getMacdSlow(), config.getMacdSignal());
    }

    @Override
    public String name() {
        return String.format("MACD %d/%d/%d", fastPeriod, slowPeriod, signalPeriod);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        var macd = TechnicalIndicators.macd(prices.closes(), fastPeriod, slowPeriod, signalPeriod);
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(MACD, macd.line());
        columns.put(MACD_SIGNAL, macd.signal());
        columns.put(MACD_HIST, macd.histogram());
        return new IndicatorSeries(prices, columns);
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        // EMA seeding makes the first slow-period bars unreliable
        if (index < slowPeriod) {
            return EntrySignal.none();
        }
        double hist = series.value(MACD_HIST, index);
        double previous = series.value(MACD_HIST, index - 1);
        if (Double.isNaN(hist) || Double.isNaN(previous)) {
            return EntrySignal.none();
        }
        if (previous < 0 && hist > 0) {
            double close = series.bar(index).close();
            return EntrySignal.of(Math.abs(hist - previous) / close * 100.0);
        }
        return EntrySignal.none();
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        if (index < slowPeriod) {
            return false;
        }
        double hist = series.value(MACD_HIST, index);
        double previous = series.value(MACD_HIST, index - 1);
        if (Double.isNaN(hist) || Double.isNaN(previous)) {
            return false;
        }
        return previous > 0 && hist < 0;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("macd", series.value(MACD, index));
        snapshot.put("macd_signal", series.value(MACD_SIGNAL, index));
        return snapshot;
    }
}
