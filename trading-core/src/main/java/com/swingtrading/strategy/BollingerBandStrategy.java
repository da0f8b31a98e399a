package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bollinger band mean reversion:
 * - Buy when the close first touches or drops through the lower band
 * - Reversal while the close sits at or above the upper band
 * Strength grows with the distance below the lower band, relative to the middle band.
 */
public final class BollingerBandStrategy implements TradingStrategy {
    public static final String BB_UPPER = "BB_UPPER";
    public static final String BB_MIDDLE = "BB_MIDDLE";
    public static final String BB_LOWER = "BB_LOWER";

    private final int period;
    private final double width;

    public BollingerBandStrategy(int period, double width) {
        if (period < 2 || !(width > 0)) {
            throw new IllegalArgumentException("Bollinger bands need a period of at least 2 and a positive width");
        }
        this.period = period;
        this.width = width;
    }

    public BollingerBandStrategy(TradingConfig config) {
        this(config.getBollingerPeriod(), config.getBollingerStdDev());
    }

    @Override
    public String name() {
        return String.format("Bollinger(%d, %.1f)", period, width);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        var bands = TechnicalIndicators.bollinger(prices.closes(), period, width);
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(BB_UPPER, bands.upper());
        columns.put(BB_MIDDLE, bands.middle());
        columns.put(BB_LOWER, bands.lower());
        return new IndicatorSeries(prices, columns);
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        if (index < 1) {
            return EntrySignal.none();
        }
        double lower = series.value(BB_LOWER, index);
        double middle = series.value(BB_MIDDLE, index);
        double previousLower = series.value(BB_LOWER, index - 1);
        if (Double.isNaN(lower) || Double.isNaN(middle) || Double.isNaN(previousLower)) {
            return EntrySignal.none();
        }
        double close = series.bar(index).close();
        double previousClose = series.bar(index - 1).close();
        if (previousClose > previousLower && close <= lower) {
            return EntrySignal.of((lower - close) / middle * 10.0);
        }
        return EntrySignal.none();
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        double upper = series.value(BB_UPPER, index);
        return !Double.isNaN(upper) && series.bar(index).close() >= upper;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("bb_lower", series.value(BB_LOWER, index));
        snapshot.put("bb_middle", series.value(BB_MIDDLE, index));
        snapshot.put("bb_upper", series.value(BB_UPPER, index));
        return snapshot;
    }
}
