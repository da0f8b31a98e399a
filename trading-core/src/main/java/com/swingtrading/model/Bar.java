package com.swingtrading.model;

import java.time.LocalDate;

/**
 * One daily OHLCV bar.
 */
public record Bar(
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    long volume
) {
    public Bar {
        if (date == null) {
            throw new IllegalArgumentException("Bar date is required");
        }
    }

    /**
     * Bar built from a single traded price, used when only a last price is known.
     */
    public static Bar ofPrice(LocalDate date, double price) {
        return new Bar(date, price, price, price, price, 0L);
    }
}
