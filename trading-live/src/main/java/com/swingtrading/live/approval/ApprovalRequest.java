package com.swingtrading.live.approval;

import com.swingtrading.model.TradeAction;

/**
 * A trade awaiting a human decision.
 */
public record ApprovalRequest(
    TradeAction action,
    String symbol,
    long quantity,
    double price,
    String reason
) {
    public String describe() {
        return String.format("%s %d %s @ %.2f (%s)", action, quantity, symbol, price, reason);
    }
}
