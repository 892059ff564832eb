package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A confirmed execution as reported by the broker.
 */
public record Fill(String symbol, OrderSide side, long quantity, BigDecimal price, Instant filledAt, String orderId) {
    public Fill {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(filledAt, "filledAt");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + quantity);
        }
    }
}
