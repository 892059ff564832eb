package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Broker account state at one instant. Replaced once per cycle.
 */
public record AccountSnapshot(
    BigDecimal equity,
    BigDecimal buyingPower,
    BigDecimal cash,
    int openPositionCount,
    Instant takenAt
) {
    public AccountSnapshot {
        Objects.requireNonNull(equity, "equity");
        Objects.requireNonNull(buyingPower, "buyingPower");
        Objects.requireNonNull(cash, "cash");
        Objects.requireNonNull(takenAt, "takenAt");
    }
}
