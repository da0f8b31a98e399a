package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Confluence of RSI and MACD. Entry needs both: RSI under the oversold level
 * on the bar where the MACD histogram crosses above zero. Either an overbought
 * RSI or a bearish histogram cross counts as a reversal.
 */
public final class MultiSignalStrategy implements TradingStrategy {
    public static final String RSI = "RSI";
    public static final String MACD_HIST = "MACD_HIST";

    private final int rsiPeriod;
    private final double oversold;
    private final double overbought;
    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MultiSignalStrategy(int rsiPeriod, double oversold, double overbought,
                               int fastPeriod, int slowPeriod, int signalPeriod) {
        if (oversold >= overbought) {
            throw new IllegalArgumentException("Oversold level must be below overbought level");
        }
        this.rsiPeriod = rsiPeriod;
        this.oversold = oversold;
        this.overbought = overbought;
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    public MultiSignalStrategy(TradingConfig config) {
        this(config.getRsiPeriod(), config.getMultiSignalRsiOversold(), config.getRsiOverbought(),
            config.getMacdFast(), config.getMacdSlow(), config.getMacdSignal());
    }

    @Override
    public String name() {
        return String.format("RSI(%d)<%.0f + MACD %d/%d/%d", rsiPeriod, oversold, fastPeriod, slowPeriod, signalPeriod);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        double[] closes = prices.closes();
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(RSI, TechnicalIndicators.rsi(closes, rsiPeriod));
        columns.put(MACD_HIST, TechnicalIndicators.macd(closes, fastPeriod, slowPeriod, signalPeriod).histogram());
        return new IndicatorSeries(prices, columns);
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        if (index < slowPeriod) {
            return EntrySignal.none();
        }
        double rsi = series.value(RSI, index);
        double hist = series.value(MACD_HIST, index);
        double previous = series.value(MACD_HIST, index - 1);
        if (Double.isNaN(rsi) || Double.isNaN(hist) || Double.isNaN(previous)) {
            return EntrySignal.none();
        }
        if (rsi < oversold && previous < 0 && hist > 0) {
            double rsiStrength = (oversold - rsi) / oversold;
            double macdStrength = Math.min(Math.abs(hist - previous) / series.bar(index).close() * 100.0, 1.0);
            return EntrySignal.of((rsiStrength + macdStrength) / 2.0);
        }
        return EntrySignal.none();
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        double rsi = series.value(RSI, index);
        if (!Double.isNaN(rsi) && rsi > overbought) {
            return true;
        }
        if (index < slowPeriod) {
            return false;
        }
        double hist = series.value(MACD_HIST, index);
        double previous = series.value(MACD_HIST, index - 1);
        return !Double.isNaN(hist) && !Double.isNaN(previous) && previous > 0 && hist < 0;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("rsi", series.value(RSI, index));
        snapshot.put("macd_hist", series.value(MACD_HIST, index));
        return snapshot;
    }
}
