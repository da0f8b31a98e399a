package com.swingtrading.error;

/**
 * Free capital cannot cover a full position allocation. Not fatal: the entry is skipped.
 */
public final class InsufficientCapitalException extends TradingException {
    private final double required;
    private final double available;

    public InsufficientCapitalException(String symbol, double required, double available) {
        super(String.format("Insufficient capital for %s: need %.2f, free %.2f", symbol, required, available));
        this.required = required;
        this.available = available;
    }

    public double getRequired() {
        return required;
    }

    public double getAvailable() {
        return available;
    }
}
