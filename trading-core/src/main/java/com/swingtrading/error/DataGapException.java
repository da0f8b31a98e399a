package com.swingtrading.error;

import java.time.LocalDate;

/**
 * Raised when a scheduled evaluation has no usable price for an instrument.
 * Callers skip the instrument for that bar and carry on.
 */
public final class DataGapException extends TradingException {
    private final String symbol;
    private final LocalDate date;
    private final int consecutiveMisses;

    public DataGapException(String symbol, LocalDate date, int consecutiveMisses) {
        super(String.format("No price for %s on %s (%d consecutive misses)", symbol, date, consecutiveMisses));
        this.symbol = symbol;
        this.date = date;
        this.consecutiveMisses = consecutiveMisses;
    }

    public String getSymbol() {
        return symbol;
    }

    public LocalDate getDate() {
        return date;
    }

    public int getConsecutiveMisses() {
        return consecutiveMisses;
    }
}
