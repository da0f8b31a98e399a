package com.swingtrading.metrics;

import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.EquityPoint;
import com.swingtrading.model.ExitReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Industry-standard performance metrics computed from a finished run:
 * Sharpe, Sortino and Calmar ratios, max drawdown, win rate, profit factor.
 * Pure functions of the closed-trade log and the equity curve.
 */
public final class PerformanceMetrics {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceMetrics.class);
    private static final int TRADING_DAYS_PER_YEAR = 252;
    private static final double DAYS_PER_YEAR = 365.25;

    private PerformanceMetrics() {
    }

    public static PerformanceReport compute(List<ClosedTrade> trades, List<EquityPoint> equityCurve,
                                            double initialCapital) {
        List<Double> values = new ArrayList<>(equityCurve.size() + 1);
        values.add(initialCapital);
        equityCurve.forEach(point -> values.add(point.totalValue()));
        double finalEquity = values.get(values.size() - 1);

        List<Double> dailyReturns = dailyReturns(values);

        double totalReturn = (finalEquity - initialCapital) / initialCapital;
        double annualizedReturn = annualizedReturn(equityCurve, initialCapital, finalEquity);
        double maxDrawdown = maxDrawdown(values);

        int wins = (int) trades.stream().filter(ClosedTrade::isWin).count();
        int losses = (int) trades.stream().filter(ClosedTrade::isLoss).count();
        double grossProfit = trades.stream().filter(ClosedTrade::isWin).mapToDouble(ClosedTrade::pnl).sum();
        double grossLoss = Math.abs(trades.stream().filter(ClosedTrade::isLoss).mapToDouble(ClosedTrade::pnl).sum());

        Map<ExitReason, Long> reasons = new EnumMap<>(ExitReason.class);
        for (ClosedTrade trade : trades) {
            reasons.merge(trade.exitReason(), 1L, Long::sum);
        }

        var report = new PerformanceReport(
            initialCapital,
            finalEquity,
            totalReturn,
            annualizedReturn,
            sharpeRatio(dailyReturns),
            sortinoRatio(dailyReturns),
            maxDrawdown == 0 ? 0.0 : annualizedReturn / maxDrawdown,
            maxDrawdown,
            trades.size(),
            wins,
            losses,
            trades.isEmpty() ? 0.0 : (double) wins / trades.size(),
            profitFactor(grossProfit, grossLoss),
            wins == 0 ? 0.0 : grossProfit / wins,
            losses == 0 ? 0.0 : -grossLoss / losses,
            trades.stream().mapToDouble(ClosedTrade::pnl).average().orElse(0.0),
            trades.stream().mapToLong(ClosedTrade::daysHeld).average().orElse(0.0),
            Collections.unmodifiableMap(reasons)
        );
        logger.debug("Computed metrics over {} trades and {} equity points", trades.size(), equityCurve.size());
        return report;
    }

    /**
     * Gross profit over gross loss; +inf when there are profits and no losses, 0 with neither.
     */
    public static double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss == 0) {
            return grossProfit > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return grossProfit / grossLoss;
    }

    static List<Double> dailyReturns(List<Double> values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1);
            if (previous != 0) {
                returns.add((values.get(i) - previous) / previous);
            }
        }
        return returns;
    }

    /**
     * Mean over sample standard deviation of daily returns, annualized with sqrt(252).
     * No risk-free rate is subtracted.
     */
    static double sharpeRatio(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double variance = returns.stream().mapToDouble(r -> Math.pow(r - mean, 2)).sum() / (returns.size() - 1);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return 0.0;
        }
        return mean / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Like Sharpe but divided by the downside deviation (root mean square of negative returns).
     */
    static double sortinoRatio(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double downside = Math.sqrt(returns.stream()
            .mapToDouble(r -> r < 0 ? r * r : 0.0)
            .average()
            .orElse(0.0));
        if (downside == 0) {
            return 0.0;
        }
        return mean / downside * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    static double maxDrawdown(List<Double> values) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0.0;
        for (double value : values) {
            peak = Math.max(peak, value);
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown;
    }

    /**
     * Compound annual growth over the calendar span of the equity curve.
     */
    static double annualizedReturn(List<EquityPoint> equityCurve, double initialCapital, double finalEquity) {
        if (equityCurve.size() < 2 || initialCapital <= 0 || finalEquity <= 0) {
            return 0.0;
        }
        long days = ChronoUnit.DAYS.between(equityCurve.get(0).date(), equityCurve.get(equityCurve.size() - 1).date());
        if (days <= 0) {
            return 0.0;
        }
        return Math.pow(finalEquity / initialCapital, DAYS_PER_YEAR / days) - 1.0;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /**
     * Print the report as a console dashboard.
     */
    public static void printDashboard(PerformanceReport report) {
        System.out.println("\n" + "=".repeat(70));
        System.out.println("                    PERFORMANCE DASHBOARD");
        System.out.println("=".repeat(70));

        System.out.println("\nRETURNS");
        System.out.printf("   Initial Capital:       %,.2f%n", report.initialCapital());
        System.out.printf("   Final Equity:          %,.2f%n", report.finalEquity());
        System.out.printf("   Total Return:          %.2f%%%n", report.totalReturn() * 100);
        System.out.printf("   Annualized Return:     %.2f%%%n", report.annualizedReturn() * 100);

        System.out.println("\nRISK METRICS");
        System.out.printf("   Sharpe Ratio:          %.2f%n", report.sharpeRatio());
        System.out.printf("   Sortino Ratio:         %.2f%n", report.sortinoRatio());
        System.out.printf("   Maximum Drawdown:      %.2f%%%n", report.maxDrawdown() * 100);
        System.out.printf("   Calmar Ratio:          %.2f%n", report.calmarRatio());

        System.out.println("\nTRADING STATISTICS");
        System.out.printf("   Total Trades:          %d (%d won, %d lost)%n",
            report.totalTrades(), report.winningTrades(), report.losingTrades());
        System.out.printf("   Win Rate:              %.1f%%%n", report.winRate() * 100);
        System.out.printf("   Profit Factor:         %s%n", formatProfitFactor(report.profitFactor()));
        System.out.printf("   Average Win:           %,.2f%n", report.averageWin());
        System.out.printf("   Average Loss:          %,.2f%n", report.averageLoss());
        System.out.printf("   Expectancy:            %,.2f%n", report.expectancy());
        System.out.printf("   Avg Days Held:         %.1f%n", report.averageDaysHeld());

        if (!report.exitReasons().isEmpty()) {
            System.out.println("\nEXIT REASONS");
            report.exitReasons().forEach((reason, count) ->
                System.out.printf("   %-22s %d%n", reason.label() + ":", count));
        }
        System.out.println("\n" + "=".repeat(70) + "\n");
    }

    public static String formatProfitFactor(double profitFactor) {
        return Double.isInfinite(profitFactor) ? "inf" : String.format("%.2f", profitFactor);
    }
}
