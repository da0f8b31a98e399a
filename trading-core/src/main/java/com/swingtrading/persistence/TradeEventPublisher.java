package com.swingtrading.persistence;

import com.swingtrading.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans trade events out to every registered sink. A failing sink is logged and
 * counted but never interrupts trading.
 */
public final class TradeEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(TradeEventPublisher.class);

    private final List<TradeEventSink> sinks;
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong published = new AtomicLong();

    public TradeEventPublisher(List<TradeEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static TradeEventPublisher none() {
        return new TradeEventPublisher(List.of());
    }

    public void publish(TradeEvent event) {
        logger.atInfo()
            .addKeyValue("symbol", event.symbol())
            .addKeyValue("action", event.action())
            .addKeyValue("price", String.format("%.2f", event.price()))
            .addKeyValue("quantity", event.quantity())
            .addKeyValue("capital", String.format("%.2f", event.capital()))
            .addKeyValue("reason", event.reason())
            .addKeyValue("pnl", event.realizedPnl() == null ? "" : String.format("%.2f", event.realizedPnl()))
            .log("Trade event: {} {}", event.action(), event.symbol());

        for (TradeEventSink sink : sinks) {
            try {
                sink.record(event);
            } catch (RuntimeException e) {
                long count = failures.incrementAndGet();
                logger.error("Trade event sink {} failed for {} {} ({} failures so far): {}",
                    sink.getClass().getSimpleName(), event.action(), event.symbol(), count, e.getMessage(), e);
            }
        }
        published.incrementAndGet();
    }

    public long getFailureCount() {
        return failures.get();
    }

    public long getPublishedCount() {
        return published.get();
    }
}
