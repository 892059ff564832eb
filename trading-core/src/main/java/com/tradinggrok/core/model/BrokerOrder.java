package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Broker-side order record.
 */
public record BrokerOrder(
    String id,
    String symbol,
    OrderSide side,
    long quantity,
    long filledQuantity,
    BigDecimal filledAvgPrice,
    BrokerOrderStatus status,
    Instant filledAt
) {
    public Fill toFill(Instant fallbackTime) {
        return new Fill(symbol, side, filledQuantity, filledAvgPrice,
            filledAt != null ? filledAt : fallbackTime, id);
    }

    public boolean hasFill() {
        return filledQuantity > 0 && filledAvgPrice != null;
    }
}
