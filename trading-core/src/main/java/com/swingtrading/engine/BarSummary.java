package com.swingtrading.engine;

import com.swingtrading.model.ClosedTrade;
import com.swingtrading.model.Position;

import java.time.LocalDate;
import java.util.List;

/**
 * What happened on one bar.
 */
public record BarSummary(
    LocalDate date,
    List<ClosedTrade> exits,
    List<Position> entries,
    boolean suspended,
    boolean tradeable,
    double equity
) {}
