package com.tradinggrok.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Broker acknowledgement of a submitted order.
 */
public record OrderHandle(String orderId, String symbol, OrderSide side, Instant submittedAt) {
    public OrderHandle {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
    }
}
