package com.swingtrading.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A price series plus indicator columns aligned bar-for-bar. Undefined
 * indicator values (warm-up period) are NaN.
 */
public final class IndicatorSeries {
    private final PriceSeries prices;
    private final Map<String, double[]> columns;

    public IndicatorSeries(PriceSeries prices, Map<String, double[]> columns) {
        this.prices = prices;
        var copy = new LinkedHashMap<String, double[]>();
        columns.forEach((name, values) -> {
            if (values.length != prices.size()) {
                throw new IllegalArgumentException("Column " + name + " has " + values.length
                    + " values for " + prices.size() + " bars of " + prices.symbol());
            }
            copy.put(name, values.clone());
        });
        this.columns = Collections.unmodifiableMap(copy);
    }

    public PriceSeries prices() {
        return prices;
    }

    public String symbol() {
        return prices.symbol();
    }

    public int size() {
        return prices.size();
    }

    public Bar bar(int index) {
        return prices.get(index);
    }

    public boolean has(String column) {
        return columns.containsKey(column);
    }

    /**
     * @return the indicator value, or NaN when the column is missing or the index is out of range
     */
    public double value(String column, int index) {
        double[] values = columns.get(column);
        if (values == null || index < 0 || index >= values.length) {
            return Double.NaN;
        }
        return values[index];
    }

    public int indexOf(LocalDate date) {
        return prices.indexOf(date);
    }
}
