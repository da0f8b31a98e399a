package com.swingtrading.model;

public enum TradeAction {
    BUY,
    SELL
}
