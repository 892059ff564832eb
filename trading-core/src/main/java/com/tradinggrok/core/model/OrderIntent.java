package com.tradinggrok.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * An order the engine wants placed. Entries always carry the thresholds they were sized with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderIntent(
    String symbol,
    OrderSide side,
    long quantity,
    OrderType type,
    BigDecimal limitPrice,
    BigDecimal referencePrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    IntentReason reason
) {
    public OrderIntent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(referencePrice, "referencePrice");
        Objects.requireNonNull(reason, "reason");
        symbol = symbol.toUpperCase(Locale.ROOT);
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        if (type == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("Limit order requires a limit price");
        }
        if (reason == IntentReason.ENTRY) {
            if (side != OrderSide.BUY) {
                throw new IllegalArgumentException("Entries are long only");
            }
            if (stopLoss == null || takeProfit == null) {
                throw new IllegalArgumentException("Entry intent requires stop-loss and take-profit");
            }
        } else if (side != OrderSide.SELL) {
            throw new IllegalArgumentException("Exit intents must sell");
        }
    }

    public static OrderIntent entry(String symbol, long quantity, BigDecimal referencePrice, Thresholds thresholds) {
        return new OrderIntent(symbol, OrderSide.BUY, quantity, OrderType.MARKET, null, referencePrice,
            thresholds.stopLoss(), thresholds.takeProfit(), IntentReason.ENTRY);
    }

    public static OrderIntent exit(String symbol, long quantity, BigDecimal referencePrice, IntentReason reason) {
        return new OrderIntent(symbol, OrderSide.SELL, quantity, OrderType.MARKET, null, referencePrice,
            null, null, reason);
    }

    @JsonIgnore
    public boolean isEntry() {
        return reason == IntentReason.ENTRY;
    }

    @JsonIgnore
    public Thresholds thresholds() {
        return isEntry() ? new Thresholds(stopLoss, takeProfit) : null;
    }

    @JsonIgnore
    public BigDecimal notional() {
        return referencePrice.multiply(BigDecimal.valueOf(quantity));
    }
}
