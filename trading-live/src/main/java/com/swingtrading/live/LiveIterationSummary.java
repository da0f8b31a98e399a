package com.swingtrading.live;

import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.Position;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one polling iteration.
 */
public record LiveIterationSummary(
    Instant timestamp,
    boolean marketOpen,
    int quotesReceived,
    List<ClosedTrade> exits,
    List<Position> entries,
    double equity
) {
    static LiveIterationSummary closed(Instant timestamp) {
        return new LiveIterationSummary(timestamp, false, 0, List.of(), List.of(), Double.NaN);
    }
}
