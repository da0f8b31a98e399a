package com.swingtrading.risk;

import java.time.LocalDate;

/**
 * One circuit-breaker activation. {@code resumeDate} is the effective date new
 * entries resume, which may be an earlier trip's date when that one was still pending.
 */
public record BreakerTrip(
    BreakerType type,
    LocalDate date,
    LocalDate resumeDate,
    double drawdown,
    int consecutiveLosses
) {}
