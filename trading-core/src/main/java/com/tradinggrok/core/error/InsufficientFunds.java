package com.tradinggrok.core.error;

import java.math.BigDecimal;

/**
 * Position sizing produced zero shares for the given equity and price.
 */
public class InsufficientFunds extends TradingException {
    private final BigDecimal equity;
    private final BigDecimal price;

    public InsufficientFunds(BigDecimal equity, BigDecimal price) {
        super("Cannot size a position: equity=" + equity + ", price=" + price);
        this.equity = equity;
        this.price = price;
    }

    public BigDecimal getEquity() {
        return equity;
    }

    public BigDecimal getPrice() {
        return price;
    }
}
