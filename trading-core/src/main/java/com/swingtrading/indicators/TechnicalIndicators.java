package com.swingtrading.indicators;

import java.util.Arrays;

/**
 * Indicator columns computed over whole arrays. Each result has the input's
 * length; positions without enough history hold NaN.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {
    }

    /**
     * Simple moving average over a trailing window.
     */
    public static double[] sma(double[] values, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        double[] result = nanArray(values.length);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                result[i] = sum / period;
            }
        }
        return result;
    }

    /**
     * Exponential moving average seeded with the first value (alpha = 2 / (span + 1)).
     * Leading NaN inputs are skipped and stay NaN.
     */
    public static double[] ema(double[] values, int span) {
        if (span < 1) {
            throw new IllegalArgumentException("Span must be positive: " + span);
        }
        double alpha = 2.0 / (span + 1.0);
        double[] result = nanArray(values.length);
        double previous = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            previous = Double.isNaN(previous) ? values[i] : alpha * values[i] + (1 - alpha) * previous;
            result[i] = previous;
        }
        return result;
    }

    /**
     * RSI from simple averages of gains and losses over {@code period} price changes.
     * A window with gains and no losses reads 100; a flat window is NaN.
     */
    public static double[] rsi(double[] closes, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        double[] result = nanArray(closes.length);
        double[] gains = new double[closes.length];
        double[] losses = new double[closes.length];
        for (int i = 1; i < closes.length; i++) {
            double delta = closes[i] - closes[i - 1];
            gains[i] = Math.max(delta, 0.0);
            losses[i] = Math.max(-delta, 0.0);
        }
        for (int i = period; i < closes.length; i++) {
            double gain = 0.0;
            double loss = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                gain += gains[j];
                loss += losses[j];
            }
            if (loss == 0.0) {
                result[i] = gain == 0.0 ? Double.NaN : 100.0;
            } else {
                double rs = gain / loss;
                result[i] = 100.0 - 100.0 / (1.0 + rs);
            }
        }
        return result;
    }

    /**
     * MACD line, signal line and histogram.
     */
    public static Macd macd(double[] closes, int fast, int slow, int signal) {
        double[] fastEma = ema(closes, fast);
        double[] slowEma = ema(closes, slow);
        double[] line = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = ema(line, signal);
        double[] histogram = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            histogram[i] = line[i] - signalLine[i];
        }
        return new Macd(line, signalLine, histogram);
    }

    /**
     * Bollinger bands: SMA middle band plus and minus {@code width} sample
     * standard deviations of the same window.
     */
    public static Bands bollinger(double[] closes, int period, double width) {
        if (period < 2) {
            throw new IllegalArgumentException("Bollinger period must be at least 2: " + period);
        }
        double[] middle = sma(closes, period);
        double[] upper = nanArray(closes.length);
        double[] lower = nanArray(closes.length);
        for (int i = period - 1; i < closes.length; i++) {
            double sumSquares = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = closes[j] - middle[i];
                sumSquares += diff * diff;
            }
            double deviation = Math.sqrt(sumSquares / (period - 1));
            upper[i] = middle[i] + width * deviation;
            lower[i] = middle[i] - width * deviation;
        }
        return new Bands(upper, middle, lower);
    }

    /**
     * Average true range: simple mean of the true range over {@code period} bars.
     * The first bar has no previous close, so its true range is high - low.
     */
    public static double[] atr(double[] highs, double[] lows, double[] closes, int period) {
        if (highs.length != closes.length || lows.length != closes.length) {
            throw new IllegalArgumentException("High, low and close arrays must have the same length");
        }
        double[] trueRange = new double[closes.length];
        for (int i = 0; i < closes.length; i++) {
            double range = highs[i] - lows[i];
            if (i > 0) {
                range = Math.max(range, Math.max(Math.abs(highs[i] - closes[i - 1]),
                    Math.abs(lows[i] - closes[i - 1])));
            }
            trueRange[i] = range;
        }
        return sma(trueRange, period);
    }

    /**
     * Highest value of the {@code period} bars before each index, excluding the bar itself.
     */
    public static double[] priorHigh(double[] values, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        double[] result = nanArray(values.length);
        for (int i = period; i < values.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int j = i - period; j < i; j++) {
                max = Math.max(max, values[j]);
            }
            result[i] = max;
        }
        return result;
    }

    /**
     * Lowest value of the {@code period} bars before each index, excluding the bar itself.
     */
    public static double[] priorLow(double[] values, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        double[] result = nanArray(values.length);
        for (int i = period; i < values.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            for (int j = i - period; j < i; j++) {
                min = Math.min(min, values[j]);
            }
            result[i] = min;
        }
        return result;
    }

    /**
     * Percent change over {@code lookback} bars ending at {@code index}, or NaN without enough history.
     */
    public static double momentumPercent(double[] closes, int index, int lookback) {
        if (index - lookback < 0 || index >= closes.length || closes[index - lookback] == 0.0) {
            return Double.NaN;
        }
        return (closes[index] - closes[index - lookback]) / closes[index - lookback] * 100.0;
    }

    private static double[] nanArray(int length) {
        double[] array = new double[length];
        Arrays.fill(array, Double.NaN);
        return array;
    }

    public record Macd(double[] line, double[] signal, double[] histogram) {}

    public record Bands(double[] upper, double[] middle, double[] lower) {}
}
