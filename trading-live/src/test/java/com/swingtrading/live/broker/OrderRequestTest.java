package com.swingtrading.live.broker;

import com.swingtrading.model.TradeAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTest {

    @Test
    @DisplayName("Valid order passes")
    void validOrder() {
        OrderRequest order = OrderRequest.buy("M&M", 25, 1_650.5, "Entry signal");

        assertSame(order, order.validate());
        assertEquals(TradeAction.BUY, order.side());
    }

    @Test
    @DisplayName("Every violation is listed at once")
    void listsAllViolations() {
        var order = new OrderRequest("reliance", TradeAction.SELL, 0, -1.0, "bad");

        assertThatThrownBy(order::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quantity: Quantity must be positive")
            .hasMessageContaining("referencePrice: Reference price must be positive")
            .hasMessageContaining("symbol: Symbol must be 1-20 uppercase NSE characters");
    }

    @Test
    @DisplayName("Quantity above the cap is rejected")
    void quantityCap() {
        var order = OrderRequest.sell("TCS", 10_000_001L, 3_500.0, "Stop Loss");

        assertThatThrownBy(order::validate).hasMessageContaining("cannot exceed");
    }

    @Test
    @DisplayName("Missing side and symbol are rejected")
    void missingFields() {
        var order = new OrderRequest(" ", null, 1, 10.0, null);

        assertThatThrownBy(order::validate)
            .hasMessageContaining("Symbol is required")
            .hasMessageContaining("Side is required");
    }
}
