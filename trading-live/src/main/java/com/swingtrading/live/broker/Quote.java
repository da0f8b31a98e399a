package com.swingtrading.live.broker;

import java.time.Instant;

/**
 * Latest market snapshot for one instrument. Any price field may be null when
 * the source did not report it.
 */
public record Quote(
    String symbol,
    Double last,
    Double dayHigh,
    Double dayLow,
    Instant timestamp
) {
    public boolean hasPrice() {
        return last != null && last > 0 && !last.isNaN();
    }

    /** Day high, or the last price when the high is missing. */
    public double highOrLast() {
        return dayHigh != null && dayHigh > 0 ? Math.max(dayHigh, last) : last;
    }

    /** Day low, or the last price when the low is missing. */
    public double lowOrLast() {
        return dayLow != null && dayLow > 0 ? Math.min(dayLow, last) : last;
    }
}
