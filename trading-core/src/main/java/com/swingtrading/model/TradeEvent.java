package com.swingtrading.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Structured record emitted to persistence sinks on every entry and exit.
 * {@code realizedPnl} is null for entries.
 */
public record TradeEvent(
    String symbol,
    TradeAction action,
    double price,
    long quantity,
    double capital,
    String reason,
    Instant timestamp,
    Double realizedPnl,
    String strategy
) {
    public static TradeEvent entry(Position position, String strategy, Instant timestamp) {
        return new TradeEvent(position.symbol(), TradeAction.BUY, position.entryPrice(),
            position.quantity(), position.capitalCommitted(),
            String.format("Entry signal (strength %.2f)", position.signalStrength()),
            timestamp, null, strategy);
    }

    public static TradeEvent exit(ClosedTrade trade, String strategy, Instant timestamp) {
        return new TradeEvent(trade.symbol(), TradeAction.SELL, trade.exitPrice(),
            trade.position().quantity(), trade.netProceeds(), trade.exitReason().label(),
            timestamp, trade.pnl(), strategy);
    }

    /** Bar dates map to the start of the day in UTC so backtest events stay reproducible. */
    public static Instant barTimestamp(LocalDate date) {
        return date.atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
