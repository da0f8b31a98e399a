package com.swingtrading.model;

import java.time.LocalDate;

/**
 * A completed round trip. {@code pnl = netProceeds - capitalCommitted}, so
 * both transaction fees are included.
 */
public record ClosedTrade(
    Position position,
    LocalDate exitDate,
    double exitPrice,
    ExitReason exitReason,
    double grossProceeds,
    double exitFee,
    double netProceeds,
    double pnl,
    double pnlPercent,
    long daysHeld,
    MarketRegime regimeAtExit
) {
    public static ClosedTrade of(Position position, LocalDate exitDate, double exitPrice,
                                 ExitReason reason, double costDecimal, MarketRegime regime) {
        double gross = exitPrice * position.quantity();
        double fee = gross * costDecimal;
        double net = gross - fee;
        double pnl = net - position.capitalCommitted();
        return new ClosedTrade(
            position.markClosed(), exitDate, exitPrice, reason,
            gross, fee, net, pnl,
            pnl / position.capitalCommitted() * 100.0,
            position.daysHeld(exitDate),
            regime == null ? MarketRegime.UNKNOWN : regime
        );
    }

    public String symbol() {
        return position.symbol();
    }

    public boolean isWin() {
        return pnl > 0;
    }

    public boolean isLoss() {
        return pnl < 0;
    }
}
