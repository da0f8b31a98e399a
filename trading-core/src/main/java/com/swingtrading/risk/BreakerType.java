package com.swingtrading.risk;

public enum BreakerType {
    DRAWDOWN,
    CONSECUTIVE_LOSSES
}
