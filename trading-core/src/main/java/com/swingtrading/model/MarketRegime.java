package com.swingtrading.model;

/**
 * Descriptive market classification from benchmark trend and 20-bar momentum.
 */
public enum MarketRegime {
    BULL,
    SIDEWAYS,
    BEAR,
    UNKNOWN
}
