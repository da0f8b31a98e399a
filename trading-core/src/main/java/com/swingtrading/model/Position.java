package com.swingtrading.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Immutable record of a long position with its risk levels.
 * Updates return a new instance; the ledger swaps them atomically.
 */
public record Position(
    String symbol,
    LocalDate entryDate,
    double entryPrice,
    long quantity,
    double capitalCommitted,  // notional + entry fee
    double entryFee,
    double stopLossPrice,
    double takeProfitPrice,
    double highestPrice,      // highest bar high seen since entry, feeds the trailing stop
    double signalStrength,
    Map<String, Double> entrySnapshot,
    PositionStatus status
) {
    public Position {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        if (entryPrice <= 0) {
            throw new IllegalArgumentException("Entry price must be positive");
        }
        if (status == PositionStatus.OPEN && quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (stopLossPrice >= entryPrice) {
            throw new IllegalArgumentException("Stop-loss must be below entry price for long positions");
        }
        if (takeProfitPrice <= entryPrice) {
            throw new IllegalArgumentException("Take-profit must be above entry price for long positions");
        }
        entrySnapshot = entrySnapshot == null ? Map.of() : Map.copyOf(entrySnapshot);
    }

    /**
     * Opens a position at {@code entryPrice} with stop and target derived from the given fractions.
     */
    public static Position open(String symbol, LocalDate entryDate, double entryPrice, long quantity,
                                double costDecimal, double stopLossDecimal, double takeProfitDecimal,
                                double signalStrength, Map<String, Double> entrySnapshot) {
        double notional = entryPrice * quantity;
        double fee = notional * costDecimal;
        return new Position(
            symbol, entryDate, entryPrice, quantity,
            notional + fee, fee,
            entryPrice * (1.0 - stopLossDecimal),
            entryPrice * (1.0 + takeProfitDecimal),
            entryPrice, signalStrength, entrySnapshot, PositionStatus.OPEN
        );
    }

    /**
     * Raises the highest price if {@code price} exceeds it. Never lowers it.
     */
    public Position withHighestPrice(double price) {
        if (price <= highestPrice) {
            return this;
        }
        return new Position(symbol, entryDate, entryPrice, quantity, capitalCommitted, entryFee,
            stopLossPrice, takeProfitPrice, price, signalStrength, entrySnapshot, status);
    }

    public Position markClosed() {
        return new Position(symbol, entryDate, entryPrice, quantity, capitalCommitted, entryFee,
            stopLossPrice, takeProfitPrice, highestPrice, signalStrength, entrySnapshot, PositionStatus.CLOSED);
    }

    /** Calendar days between entry and {@code date}. */
    public long daysHeld(LocalDate date) {
        return ChronoUnit.DAYS.between(entryDate, date);
    }

    public double trailingStopPrice(double trailDecimal) {
        return highestPrice * (1.0 - trailDecimal);
    }

    public double marketValue(double price) {
        return price * quantity;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }
}
