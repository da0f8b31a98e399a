package com.swingtrading.live;

import com.swingtrading.error.DataGapException;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts consecutive failed price fetches per instrument. Once the count
 * reaches the report threshold every further miss raises a {@link DataGapException}.
 */
public final class DataGapTracker {
    private final int reportAfter;
    private final Map<String, Integer> misses = new HashMap<>();

    public DataGapTracker(int reportAfter) {
        if (reportAfter < 1) {
            throw new IllegalArgumentException("reportAfter must be at least 1");
        }
        this.reportAfter = reportAfter;
    }

    /**
     * @throws DataGapException when the instrument has now missed {@code reportAfter} or more fetches in a row
     */
    public synchronized void recordMiss(String symbol, LocalDate date) {
        int count = misses.merge(symbol, 1, Integer::sum);
        if (count >= reportAfter) {
            throw new DataGapException(symbol, date, count);
        }
    }

    public synchronized void recordHit(String symbol) {
        misses.remove(symbol);
    }

    public synchronized int misses(String symbol) {
        return misses.getOrDefault(symbol, 0);
    }
}
