package com.swingtrading.strategy;

import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;

import java.util.Map;

/**
 * Signal evaluator shared by the backtest and live drivers. Implementations
 * read only the indicator series and have no side effects, so the same bar
 * always yields the same signal.
 */
public sealed interface TradingStrategy
    permits MovingAverageCrossoverStrategy, RsiMeanReversionStrategy, MacdCrossoverStrategy,
        BollingerBandStrategy, AtrBreakoutStrategy, MultiSignalStrategy {

    String name();

    /**
     * Compute the indicator columns this strategy reads.
     */
    IndicatorSeries prepare(PriceSeries prices);

    /**
     * Edge-triggered entry signal: true only on the bar where the entry condition first holds.
     */
    EntrySignal signal(IndicatorSeries series, int index);

    /**
     * True when the instrument's own indicators turn against an open long.
     */
    boolean trendReversed(IndicatorSeries series, int index);

    /**
     * Indicator values worth recording on the position at entry.
     */
    Map<String, Double> entrySnapshot(IndicatorSeries series, int index);
}
