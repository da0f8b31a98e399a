package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Volatility breakout. Buy when the close first clears the highest high of the
 * previous {@code lookback} bars by {@code multiplier} ATRs; the trend counts as
 * reversed when the close breaks below the previous lowest low by the same buffer.
 */
public final class AtrBreakoutStrategy implements TradingStrategy {
    public static final String ATR = "ATR";
    public static final String PRIOR_HIGH = "PRIOR_HIGH";
    public static final String PRIOR_LOW = "PRIOR_LOW";

    private final int lookback;
    private final int atrPeriod;
    private final double multiplier;

    public AtrBreakoutStrategy(int lookback, int atrPeriod, double multiplier) {
        if (lookback < 1 || atrPeriod < 1 || multiplier < 0) {
            throw new IllegalArgumentException("Lookback and ATR period must be positive, multiplier not negative");
        }
        this.lookback = lookback;
        this.atrPeriod = atrPeriod;
        this.multiplier = multiplier;
    }

    public AtrBreakoutStrategy(TradingConfig config) {
        this(config.getAtrLookback(), config.getAtrPeriod(), config.getAtrMultiplier());
    }

    @Override
    public String name() {
        return String.format("ATR breakout %d/%d x%.1f", lookback, atrPeriod, multiplier);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(ATR, TechnicalIndicators.atr(prices.highs(), prices.lows(), prices.closes(), atrPeriod));
        columns.put(PRIOR_HIGH, TechnicalIndicators.priorHigh(prices.highs(), lookback));
        columns.put(PRIOR_LOW, TechnicalIndicators.priorLow(prices.lows(), lookback));
        return new IndicatorSeries(prices, columns);
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        if (index < 1) {
            return EntrySignal.none();
        }
        double level = breakoutLevel(series, index);
        double previousLevel = breakoutLevel(series, index - 1);
        if (Double.isNaN(level) || Double.isNaN(previousLevel)) {
            return EntrySignal.none();
        }
        double close = series.bar(index).close();
        if (series.bar(index - 1).close() <= previousLevel && close > level) {
            double atr = series.value(ATR, index);
            return EntrySignal.of((close - series.value(PRIOR_HIGH, index)) / atr / 3.0);
        }
        return EntrySignal.none();
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        double low = series.value(PRIOR_LOW, index);
        double atr = series.value(ATR, index);
        if (Double.isNaN(low) || Double.isNaN(atr)) {
            return false;
        }
        return series.bar(index).close() < low - atr * multiplier;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("atr", series.value(ATR, index));
        snapshot.put("prior_high", series.value(PRIOR_HIGH, index));
        return snapshot;
    }

    private double breakoutLevel(IndicatorSeries series, int index) {
        return series.value(PRIOR_HIGH, index) + series.value(ATR, index) * multiplier;
    }
}
