package com.swingtrading.persistence;

import com.swingtrading.model.TradeEvent;

/**
 * External store for trade events (database, log, message bus).
 */
@FunctionalInterface
public interface TradeEventSink {

    /**
     * @throws com.swingtrading.error.ExternalServiceException when the store is unavailable
     */
    void record(TradeEvent event);
}
