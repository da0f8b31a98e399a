package com.swingtrading.config;

import com.swingtrading.error.InvalidConfigurationException;
import com.swingtrading.portfolio.SizingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Centralized trading configuration loaded from a properties file.
 * Every engine component receives an instance explicitly, so independent
 * backtests can run side by side with different parameters.
 *
 * Percent values are written as percentages (3.0 = 3%); use the *Decimal
 * getters for arithmetic.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);

    private final Properties properties;

    // Capital and sizing
    private final double initialCapital;
    private final int maxPositions;
    private final SizingMode sizingMode;
    private final double transactionCostPercent;

    // Exit rules
    private final double stopLossPercent;
    private final double takeProfitPercent;
    private final double trailingStopPercent;
    private final int minHoldDays;
    private final int maxHoldDays;

    // Entry gating
    private final double minSignalStrength;
    private final boolean regimeFilterEnabled;
    private final int regimeMaPeriod;
    private final String benchmarkSymbol;
    private final int reentryCooldownDays;

    // Circuit breakers
    private final double maxDrawdownPercent;
    private final int maxConsecutiveLosses;
    private final int circuitBreakerCooldownDays;

    // Strategy
    private final String strategy;
    private final int maShortPeriod;
    private final int maLongPeriod;
    private final int volumeMaPeriod;
    private final double volumeConfirmationMultiplier;
    private final int rsiPeriod;
    private final double rsiOversold;
    private final double rsiOverbought;
    private final int macdFast;
    private final int macdSlow;
    private final int macdSignal;
    private final int bollingerPeriod;
    private final double bollingerStdDev;
    private final int atrPeriod;
    private final int atrLookback;
    private final double atrMultiplier;
    private final double multiSignalRsiOversold;

    // Live trading
    private final LocalTime tradingStartTime;
    private final LocalTime tradingEndTime;
    private final ZoneId tradingZone;
    private final boolean requireManualApproval;
    private final long approvalTimeoutSeconds;
    private final long checkIntervalSeconds;
    private final int dataGapReportAfter;
    private final List<String> symbols;

    private TradingConfig(Properties props) {
        this.properties = props;

        this.initialCapital = parseDouble("INITIAL_CAPITAL", 100_000.0);
        this.maxPositions = parseInt("MAX_POSITIONS", 3);
        this.sizingMode = parseEnum("SIZING_MODE", SizingMode.class, SizingMode.FIXED_INITIAL);
        this.transactionCostPercent = parseDouble("TRANSACTION_COST_PERCENT", 0.1);

        this.stopLossPercent = parseDouble("STOP_LOSS_PERCENT", 3.0);
        this.takeProfitPercent = parseDouble("TAKE_PROFIT_PERCENT", 12.0);
        this.trailingStopPercent = parseDouble("TRAILING_STOP_PERCENT", 3.0);
        this.minHoldDays = parseInt("MIN_HOLD_DAYS", 21);
        this.maxHoldDays = parseInt("MAX_HOLD_DAYS", 25);

        this.minSignalStrength = parseDouble("MIN_SIGNAL_STRENGTH", 0.37);
        this.regimeFilterEnabled = parseBoolean("REGIME_FILTER_ENABLED", true);
        this.regimeMaPeriod = parseInt("REGIME_MA_PERIOD", 50);
        this.benchmarkSymbol = properties.getProperty("BENCHMARK_SYMBOL", "NIFTY50").trim();
        this.reentryCooldownDays = parseInt("REENTRY_COOLDOWN_DAYS", 10);

        this.maxDrawdownPercent = parseDouble("MAX_DRAWDOWN_PERCENT", 15.0);
        this.maxConsecutiveLosses = parseInt("MAX_CONSECUTIVE_LOSSES", 5);
        this.circuitBreakerCooldownDays = parseInt("CIRCUIT_BREAKER_COOLDOWN_DAYS", 10);

        this.strategy = properties.getProperty("STRATEGY", "MA_CROSSOVER").trim();
        this.maShortPeriod = parseInt("MA_SHORT_PERIOD", 20);
        this.maLongPeriod = parseInt("MA_LONG_PERIOD", 50);
        this.volumeMaPeriod = parseInt("VOLUME_MA_PERIOD", 20);
        this.volumeConfirmationMultiplier = parseDouble("VOLUME_CONFIRMATION_MULTIPLIER", 0.0);
        this.rsiPeriod = parseInt("RSI_PERIOD", 14);
        this.rsiOversold = parseDouble("RSI_OVERSOLD", 30.0);
        this.rsiOverbought = parseDouble("RSI_OVERBOUGHT", 70.0);
        this.macdFast = parseInt("MACD_FAST", 12);
        this.macdSlow = parseInt("MACD_SLOW", 26);
        this.macdSignal = parseInt("MACD_SIGNAL", 9);
        this.bollingerPeriod = parseInt("BB_PERIOD", 20);
        this.bollingerStdDev = parseDouble("BB_STD_DEV", 2.0);
        this.atrPeriod = parseInt("ATR_PERIOD", 14);
        this.atrLookback = parseInt("ATR_LOOKBACK", 20);
        this.atrMultiplier = parseDouble("ATR_MULTIPLIER", 1.5);
        this.multiSignalRsiOversold = parseDouble("MULTI_SIGNAL_RSI_OVERSOLD", 40.0);

        this.tradingStartTime = parseTime("TRADING_START_TIME", LocalTime.of(9, 30));
        this.tradingEndTime = parseTime("TRADING_END_TIME", LocalTime.of(15, 0));
        this.tradingZone = parseZone("TRADING_ZONE", ZoneId.of("Asia/Kolkata"));
        this.requireManualApproval = parseBoolean("REQUIRE_MANUAL_APPROVAL", true);
        this.approvalTimeoutSeconds = parseLong("APPROVAL_TIMEOUT_SECONDS", 120);
        this.checkIntervalSeconds = parseLong("CHECK_INTERVAL_SECONDS", 300);
        this.dataGapReportAfter = parseInt("DATA_GAP_REPORT_AFTER", 2);
        this.symbols = parseList("SYMBOLS");
    }

    // ==================== Parsing ====================

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private int parseInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private <E extends Enum<E>> E parseEnum(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private LocalTime parseTime(String key, LocalTime defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private ZoneId parseZone(String key, ZoneId defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (RuntimeException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private List<String> parseList(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    // ==================== Loading ====================

    /**
     * Load configuration from config.properties, trying the working directory
     * first and the classpath second.
     */
    public static TradingConfig load() {
        return load(Path.of("config.properties"));
    }

    public static TradingConfig load(Path configPath) {
        Properties props = new Properties();

        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", configPath, e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new TradingConfig(props);
    }

    /**
     * Create an instance from explicit properties (tests, parameter sweeps).
     */
    public static TradingConfig forTest(Properties testProps) {
        return new TradingConfig(testProps);
    }

    /**
     * Returns a copy with the given overrides applied on top of this configuration.
     */
    public TradingConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key, value);
        return new TradingConfig(copy);
    }

    // ==================== Validation ====================

    /**
     * Check every parameter range. Called before a run starts.
     *
     * @throws InvalidConfigurationException listing all violations at once
     */
    public TradingConfig validate() {
        List<String> violations = new ArrayList<>();

        if (!(initialCapital > 0)) {
            violations.add("INITIAL_CAPITAL must be positive");
        }
        if (maxPositions < 1) {
            violations.add("MAX_POSITIONS must be at least 1");
        }
        if (!(stopLossPercent > 0) || stopLossPercent >= 100) {
            violations.add("STOP_LOSS_PERCENT must be in (0, 100)");
        }
        if (!(takeProfitPercent > 0)) {
            violations.add("TAKE_PROFIT_PERCENT must be positive");
        }
        if (stopLossPercent >= takeProfitPercent) {
            violations.add("STOP_LOSS_PERCENT must be below TAKE_PROFIT_PERCENT");
        }
        if (!(trailingStopPercent > 0) || trailingStopPercent >= 100) {
            violations.add("TRAILING_STOP_PERCENT must be in (0, 100)");
        }
        if (minHoldDays < 0) {
            violations.add("MIN_HOLD_DAYS must not be negative");
        }
        if (maxHoldDays < 1 || minHoldDays > maxHoldDays) {
            violations.add("MAX_HOLD_DAYS must be at least 1 and not below MIN_HOLD_DAYS");
        }
        if (minSignalStrength < 0 || minSignalStrength > 1) {
            violations.add("MIN_SIGNAL_STRENGTH must be in [0, 1]");
        }
        if (regimeMaPeriod < 1) {
            violations.add("REGIME_MA_PERIOD must be at least 1");
        }
        if (!(maxDrawdownPercent > 0) || maxDrawdownPercent > 100) {
            violations.add("MAX_DRAWDOWN_PERCENT must be in (0, 100]");
        }
        if (maxConsecutiveLosses < 1) {
            violations.add("MAX_CONSECUTIVE_LOSSES must be at least 1");
        }
        if (circuitBreakerCooldownDays < 0 || reentryCooldownDays < 0) {
            violations.add("Cooldown lengths must not be negative");
        }
        if (transactionCostPercent < 0 || transactionCostPercent >= 100) {
            violations.add("TRANSACTION_COST_PERCENT must be in [0, 100)");
        }
        if (maShortPeriod < 1 || maShortPeriod >= maLongPeriod) {
            violations.add("MA_SHORT_PERIOD must be positive and below MA_LONG_PERIOD");
        }
        if (rsiOversold >= rsiOverbought) {
            violations.add("RSI_OVERSOLD must be below RSI_OVERBOUGHT");
        }
        if (macdFast < 1 || macdFast >= macdSlow || macdSignal < 1) {
            violations.add("MACD periods must satisfy 0 < MACD_FAST < MACD_SLOW and MACD_SIGNAL > 0");
        }
        if (bollingerPeriod < 2 || !(bollingerStdDev > 0)) {
            violations.add("BB_PERIOD must be at least 2 and BB_STD_DEV positive");
        }
        if (atrPeriod < 1 || atrLookback < 1 || atrMultiplier < 0) {
            violations.add("ATR_PERIOD and ATR_LOOKBACK must be positive and ATR_MULTIPLIER not negative");
        }
        if (!(multiSignalRsiOversold > 0) || multiSignalRsiOversold >= rsiOverbought) {
            violations.add("MULTI_SIGNAL_RSI_OVERSOLD must be positive and below RSI_OVERBOUGHT");
        }
        if (!tradingStartTime.isBefore(tradingEndTime)) {
            violations.add("TRADING_START_TIME must be before TRADING_END_TIME");
        }
        if (checkIntervalSeconds < 1 || approvalTimeoutSeconds < 1) {
            violations.add("CHECK_INTERVAL_SECONDS and APPROVAL_TIMEOUT_SECONDS must be positive");
        }
        if (dataGapReportAfter < 1) {
            violations.add("DATA_GAP_REPORT_AFTER must be at least 1");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
        return this;
    }

    /**
     * Log the parameters that drive the engine.
     */
    public void logSummary() {
        logger.info("Trading Configuration:");
        logger.info("   Capital: {} across {} positions ({})",
            String.format("%,.2f", initialCapital), maxPositions, sizingMode);
        logger.info("   Stop-Loss: {}% | Take-Profit: {}% | Trailing: {}%",
            String.format("%.2f", stopLossPercent), String.format("%.2f", takeProfitPercent),
            String.format("%.2f", trailingStopPercent));
        logger.info("   Hold: {}-{} days | Min strength: {}",
            minHoldDays, maxHoldDays, String.format("%.2f", minSignalStrength));
        logger.info("   Breakers: DD {}% | {} losses | {} day cooldown",
            String.format("%.1f", maxDrawdownPercent), maxConsecutiveLosses, circuitBreakerCooldownDays);
        logger.info("   Strategy: {} | Regime filter: {} ({} on {}-day MA)",
            strategy, regimeFilterEnabled ? "ON" : "OFF", benchmarkSymbol, regimeMaPeriod);
    }

    // ==================== Getters ====================

    public double getInitialCapital() {
        return initialCapital;
    }

    public int getMaxPositions() {
        return maxPositions;
    }

    public SizingMode getSizingMode() {
        return sizingMode;
    }

    /** Transaction cost percentage per side (0.1 = 0.1%) */
    public double getTransactionCostPercent() {
        return transactionCostPercent;
    }

    public double getTransactionCostDecimal() {
        return transactionCostPercent / 100.0;
    }

    public double getStopLossPercent() {
        return stopLossPercent;
    }

    public double getStopLossDecimal() {
        return stopLossPercent / 100.0;
    }

    public double getTakeProfitPercent() {
        return takeProfitPercent;
    }

    public double getTakeProfitDecimal() {
        return takeProfitPercent / 100.0;
    }

    public double getTrailingStopPercent() {
        return trailingStopPercent;
    }

    public double getTrailingStopDecimal() {
        return trailingStopPercent / 100.0;
    }

    public int getMinHoldDays() {
        return minHoldDays;
    }

    public int getMaxHoldDays() {
        return maxHoldDays;
    }

    public double getMinSignalStrength() {
        return minSignalStrength;
    }

    public boolean isRegimeFilterEnabled() {
        return regimeFilterEnabled;
    }

    public int getRegimeMaPeriod() {
        return regimeMaPeriod;
    }

    public String getBenchmarkSymbol() {
        return benchmarkSymbol;
    }

    /** Days an instrument stays blocked after a losing exit */
    public int getReentryCooldownDays() {
        return reentryCooldownDays;
    }

    public double getMaxDrawdownPercent() {
        return maxDrawdownPercent;
    }

    public double getMaxDrawdownDecimal() {
        return maxDrawdownPercent / 100.0;
    }

    public int getMaxConsecutiveLosses() {
        return maxConsecutiveLosses;
    }

    /** Days new entries stay suspended after a circuit breaker trips */
    public int getCircuitBreakerCooldownDays() {
        return circuitBreakerCooldownDays;
    }

    public String getStrategy() {
        return strategy;
    }

    public int getMaShortPeriod() {
        return maShortPeriod;
    }

    public int getMaLongPeriod() {
        return maLongPeriod;
    }

    public int getVolumeMaPeriod() {
        return volumeMaPeriod;
    }

    /** Minimum volume / volume-MA ratio for an entry; 0 disables the check */
    public double getVolumeConfirmationMultiplier() {
        return volumeConfirmationMultiplier;
    }

    public int getRsiPeriod() {
        return rsiPeriod;
    }

    public double getRsiOversold() {
        return rsiOversold;
    }

    public double getRsiOverbought() {
        return rsiOverbought;
    }

    public int getMacdFast() {
        return macdFast;
    }

    public int getMacdSlow() {
        return macdSlow;
    }

    public int getMacdSignal() {
        return macdSignal;
    }

    public int getBollingerPeriod() {
        return bollingerPeriod;
    }

    public double getBollingerStdDev() {
        return bollingerStdDev;
    }

    public int getAtrPeriod() {
        return atrPeriod;
    }

    public int getAtrLookback() {
        return atrLookback;
    }

    public double getAtrMultiplier() {
        return atrMultiplier;
    }

    public double getMultiSignalRsiOversold() {
        return multiSignalRsiOversold;
    }

    public LocalTime getTradingStartTime() {
        return tradingStartTime;
    }

    public LocalTime getTradingEndTime() {
        return tradingEndTime;
    }

    public ZoneId getTradingZone() {
        return tradingZone;
    }

    public boolean isRequireManualApproval() {
        return requireManualApproval;
    }

    public long getApprovalTimeoutSeconds() {
        return approvalTimeoutSeconds;
    }

    public long getCheckIntervalSeconds() {
        return checkIntervalSeconds;
    }

    public int getDataGapReportAfter() {
        return dataGapReportAfter;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    /** Get raw property value */
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    /** Get property with default */
    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }
}
