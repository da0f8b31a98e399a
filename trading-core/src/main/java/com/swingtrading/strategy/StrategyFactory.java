package com.swingtrading.strategy;

import com.swingtrading.config.TradingConfig;
import com.swingtrading.error.InvalidConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * Builds the strategy named by the {@code STRATEGY} option.
 */
public final class StrategyFactory {

    private StrategyFactory() {
    }

    public static TradingStrategy create(TradingConfig config) {
        String name = config.getStrategy().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "MA_CROSSOVER" -> new MovingAverageCrossoverStrategy(config);
            case "RSI_MEAN_REVERSION" -> new RsiMeanReversionStrategy(config);
            case "MACD_CROSSOVER" -> new MacdCrossoverStrategy(config);
            case "BOLLINGER_BAND" -> new BollingerBandStrategy(config);
            case "ATR_BREAKOUT" -> new AtrBreakoutStrategy(config);
            case "MULTI_SIGNAL" -> new MultiSignalStrategy(config);
            default -> throw new InvalidConfigurationException(List.of("STRATEGY must be one of MA_CROSSOVER, "
                + "RSI_MEAN_REVERSION, MACD_CROSSOVER, BOLLINGER_BAND, ATR_BREAKOUT, MULTI_SIGNAL but was " + name));
        };
    }
}
