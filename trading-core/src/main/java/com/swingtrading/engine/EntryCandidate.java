package com.swingtrading.engine;

import java.util.Map;

/**
 * Instrument that passed every per-instrument entry filter on a bar.
 * Fills at the signal bar's close.
 */
public record EntryCandidate(
    String symbol,
    double strength,
    double price,
    Map<String, Double> snapshot
) {}
