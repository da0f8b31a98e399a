package com.swingtrading.model;

/**
 * The five exit kinds, declared in evaluation priority order.
 */
public enum ExitReason {
    STOP_LOSS("Stop Loss"),
    TAKE_PROFIT("Take Profit"),
    TRAILING_STOP("Trailing Stop"),
    DEATH_CROSS("Death Cross"),
    MAX_HOLD("Max Hold Period");

    private final String label;

    ExitReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
