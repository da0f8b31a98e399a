package com.swingtrading.metrics;

import com.swingtrading.model.ExitReason;

import java.util.Map;

/**
 * End-of-run statistics. Ratios are fractions (0.12 = 12%) except {@code winRate},
 * which is also a fraction of closed trades. {@code profitFactor} is
 * {@link Double#POSITIVE_INFINITY} when there are winning trades and no losing ones.
 */
public record PerformanceReport(
    double initialCapital,
    double finalEquity,
    double totalReturn,
    double annualizedReturn,
    double sharpeRatio,
    double sortinoRatio,
    double calmarRatio,
    double maxDrawdown,
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double profitFactor,
    double averageWin,
    double averageLoss,
    double expectancy,
    double averageDaysHeld,
    Map<ExitReason, Long> exitReasons
) {}
