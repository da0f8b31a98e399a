package com.swingtrading.analysis;

import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.MarketRegime;
import com.swingtrading.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Market-wide entry gate based on a benchmark index.
 * <p>
 * A date is tradeable when the benchmark closes above its trailing SMA.
 * The filter only blocks new entries; it never forces an exit.
 */
public final class MarketRegimeFilter {
    private static final Logger logger = LoggerFactory.getLogger(MarketRegimeFilter.class);

    private static final int MOMENTUM_LOOKBACK = 20;
    private static final double MOMENTUM_THRESHOLD_PERCENT = 2.0;

    private final boolean enabled;
    private final PriceSeries benchmark;
    private final double[] closes;
    private final double[] movingAverage;

    /**
     * @param enabled   false makes every date tradeable
     * @param benchmark benchmark bars, or null when no benchmark is configured
     * @param maPeriod  trailing SMA period
     */
    public MarketRegimeFilter(boolean enabled, PriceSeries benchmark, int maPeriod) {
        this.enabled = enabled;
        this.benchmark = benchmark;
        if (benchmark != null) {
            this.closes = benchmark.closes();
            this.movingAverage = TechnicalIndicators.sma(closes, maPeriod);
        } else {
            this.closes = new double[0];
            this.movingAverage = new double[0];
        }
        logger.debug("Regime filter {} (benchmark: {}, {}-day MA)",
            enabled ? "enabled" : "disabled", benchmark == null ? "none" : benchmark.symbol(), maPeriod);
    }

    public static MarketRegimeFilter disabled() {
        return new MarketRegimeFilter(false, null, 1);
    }

    /**
     * New entries are allowed on this date.
     */
    public boolean isTradeable(LocalDate date) {
        if (!enabled || benchmark == null) {
            return true;
        }
        int index = benchmark.indexOf(date);
        if (index < 0) {
            return false;
        }
        double ma = movingAverage[index];
        if (Double.isNaN(ma)) {
            return false;
        }
        return closes[index] > ma;
    }

    /**
     * Descriptive regime for reporting: side of the SMA combined with 20-bar momentum.
     */
    public MarketRegime classify(LocalDate date) {
        if (benchmark == null) {
            return MarketRegime.UNKNOWN;
        }
        int index = benchmark.indexOf(date);
        if (index < 0 || Double.isNaN(movingAverage[index])) {
            return MarketRegime.UNKNOWN;
        }
        double momentum = TechnicalIndicators.momentumPercent(closes, index, MOMENTUM_LOOKBACK);
        if (Double.isNaN(momentum)) {
            return MarketRegime.UNKNOWN;
        }
        if (closes[index] > movingAverage[index]) {
            return momentum > MOMENTUM_THRESHOLD_PERCENT ? MarketRegime.BULL : MarketRegime.SIDEWAYS;
        }
        return momentum < -MOMENTUM_THRESHOLD_PERCENT ? MarketRegime.BEAR : MarketRegime.SIDEWAYS;
    }
}
