package com.swingtrading.live.broker;

/**
 * Broker's answer to an order.
 */
public record OrderResult(
    String orderId,
    Status status,
    long filledQuantity,
    double fillPrice,
    String message
) {
    public enum Status {
        FILLED, REJECTED
    }

    public static OrderResult filled(String orderId, long quantity, double price) {
        return new OrderResult(orderId, Status.FILLED, quantity, price, "filled");
    }

    public static OrderResult rejected(String orderId, String message) {
        return new OrderResult(orderId, Status.REJECTED, 0, 0.0, message);
    }

    public boolean isFilled() {
        return status == Status.FILLED && filledQuantity > 0;
    }
}
