package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.Map;

/**
 * RSI mean reversion.
 * Buy when RSI drops below the oversold level; the trend counts as reversed
 * once RSI climbs above the overbought level. Strength is how far below the
 * oversold line RSI sits.
 */
public final class RsiMeanReversionStrategy implements TradingStrategy {
    public static final String RSI = "RSI";

    private final int period;
    private final double oversold;
    private final double overbought;

    public RsiMeanReversionStrategy(int period, double oversold, double overbought) {
        if (oversold >= overbought) {
            throw new IllegalArgumentException("Oversold level must be below overbought level");
        }
        this.period = period;
        this.oversold = oversold;
        this.overbought = overbought;
    }

    public RsiMeanReversionStrategy(TradingConfig config) {
        this(config.getRsiPeriod(), config.getRsiOversold(), config.getRsiOverbought());
    }

    @Override
    public String name() {
        return String.format("RSI(%d) %.0f/%.0f", period, oversold, overbought);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        return new IndicatorSeries(prices, Map.of(RSI, TechnicalIndicators.rsi(prices.closes(), period)));
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        double rsi = series.value(RSI, index);
        double previous = series.value(RSI, index - 1);
        if (Double.isNaN(rsi) || Double.isNaN(previous)) {
            return EntrySignal.none();
        }
        if (previous >= oversold && rsi < oversold) {
            return EntrySignal.of((oversold - rsi) / oversold);
        }
        return EntrySignal.none();
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        double rsi = series.value(RSI, index);
        double previous = series.value(RSI, index - 1);
        if (Double.isNaN(rsi) || Double.isNaN(previous)) {
            return false;
        }
        return previous <= overbought && rsi > overbought;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        return Map.of("rsi", series.value(RSI, index));
    }
}
