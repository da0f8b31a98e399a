package com.swingtrading.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered daily bars for one instrument. Dates are strictly increasing.
 */
public final class PriceSeries {
    private final String symbol;
    private final List<Bar> bars;
    private final Map<LocalDate, Integer> indexByDate;

    public PriceSeries(String symbol, List<Bar> bars) {
        this.symbol = symbol;
        this.bars = List.copyOf(bars);
        this.indexByDate = new HashMap<>();
        for (int i = 0; i < this.bars.size(); i++) {
            var date = this.bars.get(i).date();
            if (i > 0 && !date.isAfter(this.bars.get(i - 1).date())) {
                throw new IllegalArgumentException(
                    "Bars for " + symbol + " are not strictly increasing at " + date);
            }
            indexByDate.put(date, i);
        }
    }

    public String symbol() {
        return symbol;
    }

    public List<Bar> bars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public Bar last() {
        return bars.get(bars.size() - 1);
    }

    /**
     * @return bar index for the date, or -1 when the instrument has no bar that day
     */
    public int indexOf(LocalDate date) {
        Integer index = indexByDate.get(date);
        return index == null ? -1 : index;
    }

    public double[] closes() {
        return bars.stream().mapToDouble(Bar::close).toArray();
    }

    public double[] highs() {
        return bars.stream().mapToDouble(Bar::high).toArray();
    }

    public double[] lows() {
        return bars.stream().mapToDouble(Bar::low).toArray();
    }

    public double[] volumes() {
        return bars.stream().mapToDouble(Bar::volume).toArray();
    }

    /**
     * Returns a copy whose last bar for {@code bar.date()} is replaced or appended.
     * Used by the live driver to turn a quote into the current bar.
     */
    public PriceSeries withBar(Bar bar) {
        var updated = new ArrayList<Bar>(bars.size() + 1);
        for (Bar existing : bars) {
            if (existing.date().isBefore(bar.date())) {
                updated.add(existing);
            }
        }
        updated.add(bar);
        return new PriceSeries(symbol, updated);
    }
}
