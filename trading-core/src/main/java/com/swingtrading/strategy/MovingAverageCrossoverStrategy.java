package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.indicators.TechnicalIndicators;
import com.swingtrading.model.Bar;
import com.swingtrading.model.IndicatorSeries;
import com.swingtrading.model.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Golden Cross / Death Cross on two simple moving averages.
 * <ul>
 *   <li>Entry: fast SMA crosses ABOVE slow SMA, optionally confirmed by volume</li>
 *   <li>Reversal: fast SMA crosses BELOW slow SMA</li>
 * </ul>
 * Strength weights MA separation (40%), crossover slope (30%), distance of
 * the close from the fast MA (20%) and the volume ratio (10%), all in percent
 * terms, clamped to [0, 1].
 */
public final class MovingAverageCrossoverStrategy implements TradingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(MovingAverageCrossoverStrategy.class);

    public static final String MA_FAST = "MA_FAST";
    public static final String MA_SLOW = "MA_SLOW";
    public static final String VOLUME_MA = "VOLUME_MA";

    private static final double SEPARATION_WEIGHT = 0.4;
    private static final double MOMENTUM_WEIGHT = 0.3;
    private static final double PRICE_POSITION_WEIGHT = 0.2;
    private static final double VOLUME_WEIGHT = 0.1;

    private final int fastPeriod;
    private final int slowPeriod;
    private final int volumePeriod;
    private final double volumeMultiplier;

    public MovingAverageCrossoverStrategy(int fastPeriod, int slowPeriod, int volumePeriod, double volumeMultiplier) {
        if (fastPeriod < 1 || fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("Fast period must be positive and below slow period");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.volumePeriod = volumePeriod;
        this.volumeMultiplier = volumeMultiplier;
    }

    public MovingAverageCrossoverStrategy(TradingConfig config) {
        this(config.getMaShortPeriod(), config.getMaLongPeriod(),
            config.getVolumeMaPeriod(), config.getVolumeConfirmationMultiplier());
    }

    @Override
    public String name() {
        return String.format("MA Crossover %d/%d", fastPeriod, slowPeriod);
    }

    @Override
    public IndicatorSeries prepare(PriceSeries prices) {
        double[] closes = prices.closes();
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(MA_FAST, TechnicalIndicators.sma(closes, fastPeriod));
        columns.put(MA_SLOW, TechnicalIndicators.sma(closes, slowPeriod));
        if (volumePeriod > 0) {
            columns.put(VOLUME_MA, TechnicalIndicators.sma(prices.volumes(), volumePeriod));
        }
        return new IndicatorSeries(prices, columns);
    }

    @Override
    public EntrySignal signal(IndicatorSeries series, int index) {
        if (index < 1 || index >= series.size()) {
            return EntrySignal.none();
        }
        double fast = series.value(MA_FAST, index);
        double slow = series.value(MA_SLOW, index);
        double fastPrev = series.value(MA_FAST, index - 1);
        double slowPrev = series.value(MA_SLOW, index - 1);
        if (Double.isNaN(fast) || Double.isNaN(slow) || Double.isNaN(fastPrev) || Double.isNaN(slowPrev)) {
            return EntrySignal.none();
        }

        boolean goldenCross = fastPrev <= slowPrev && fast > slow;
        if (!goldenCross) {
            return EntrySignal.none();
        }

        Bar bar = series.bar(index);
        double volumeMa = series.value(VOLUME_MA, index);
        if (volumeMultiplier > 0 && (Double.isNaN(volumeMa) || bar.volume() < volumeMa * volumeMultiplier)) {
            logger.debug("{}: Golden Cross on {} rejected by volume filter", series.symbol(), bar.date());
            return EntrySignal.none();
        }

        double separation = Math.abs((fast - slow) / slow * 100.0);
        double momentum = Math.abs((fast - fastPrev) - (slow - slowPrev)) / slow * 100.0;
        double pricePosition = Math.abs((bar.close() - fast) / fast * 100.0);
        double volumeScore = (Double.isNaN(volumeMa) || volumeMa <= 0) ? 0.0 : bar.volume() / volumeMa - 1.0;

        double raw = separation * SEPARATION_WEIGHT
            + momentum * MOMENTUM_WEIGHT
            + pricePosition * PRICE_POSITION_WEIGHT
            + volumeScore * VOLUME_WEIGHT;

        EntrySignal signal = EntrySignal.of(raw);
        logger.debug("{}: Golden Cross on {} (fast={}, slow={}, strength={})", series.symbol(), bar.date(),
            String.format("%.2f", fast), String.format("%.2f", slow), String.format("%.3f", signal.strength()));
        return signal;
    }

    @Override
    public boolean trendReversed(IndicatorSeries series, int index) {
        if (index < 1 || index >= series.size()) {
            return false;
        }
        double fast = series.value(MA_FAST, index);
        double slow = series.value(MA_SLOW, index);
        double fastPrev = series.value(MA_FAST, index - 1);
        double slowPrev = series.value(MA_SLOW, index - 1);
        if (Double.isNaN(fast) || Double.isNaN(slow) || Double.isNaN(fastPrev) || Double.isNaN(slowPrev)) {
            return false;
        }
        return fastPrev >= slowPrev && fast < slow;
    }

    @Override
    public Map<String, Double> entrySnapshot(IndicatorSeries series, int index) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("ma_fast", series.value(MA_FAST, index));
        snapshot.put("ma_slow", series.value(MA_SLOW, index));
        return snapshot;
    }
}
