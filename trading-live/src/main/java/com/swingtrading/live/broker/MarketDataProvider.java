package com.swingtrading.live.broker;

import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.PriceSeries;

/**
 * Source of live quotes and the daily history the indicators warm up on.
 */
public interface MarketDataProvider {

    /**
     * @throws ExternalServiceException when the source is unreachable or answers without a usable quote
     */
    Quote fetchQuote(String symbol);

    /**
     * Most recent {@code days} daily bars, oldest first.
     *
     * @throws ExternalServiceException when the history cannot be read
     */
    PriceSeries fetchDailyHistory(String symbol, int days);
}
