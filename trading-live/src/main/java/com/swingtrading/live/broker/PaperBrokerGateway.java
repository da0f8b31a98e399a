package com.swingtrading.live.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated broker: every valid order fills in full at its reference price.
 */
public final class PaperBrokerGateway implements BrokerGateway {
    private static final Logger logger = LoggerFactory.getLogger(PaperBrokerGateway.class);

    private final AtomicLong sequence = new AtomicLong();
    private final List<OrderRequest> orders = new ArrayList<>();

    @Override
    public synchronized OrderResult placeOrder(OrderRequest request) {
        String orderId = "PAPER-" + sequence.incrementAndGet();
        try {
            request.validate();
        } catch (IllegalArgumentException e) {
            logger.warn("{} rejected: {}", orderId, e.getMessage());
            return OrderResult.rejected(orderId, e.getMessage());
        }
        orders.add(request);
        logger.info("[PAPER] {} {} {} @ {} ({})", orderId, request.side(), request.quantity(),
            String.format("%.2f", request.referencePrice()), request.symbol());
        return OrderResult.filled(orderId, request.quantity(), request.referencePrice());
    }

    @Override
    public String name() {
        return "paper";
    }

    public synchronized List<OrderRequest> getOrders() {
        return List.copyOf(orders);
    }
}
