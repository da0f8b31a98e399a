package com.swingtrading.model;

import java.time.LocalDate;

/**
 * Portfolio value at the close of one bar.
 */
public record EquityPoint(
    LocalDate date,
    double totalValue,
    double freeCapital,
    int openPositions
) {}
