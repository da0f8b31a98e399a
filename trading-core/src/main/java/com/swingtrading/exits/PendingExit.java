package com.swingtrading.exits;

import com.swingtrading.model.Position;

import java.time.LocalDate;

/**
 * Exit decided for a position but not yet settled in the ledger.
 */
public record PendingExit(Position position, LocalDate date, ExitDecision decision) {

    public String symbol() {
        return position.symbol();
    }
}
