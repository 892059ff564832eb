package com.tradinggrok.core.error;

/**
 * The broker answered and refused the order. Nothing was placed.
 */
public class OrderRejected extends TradingException {
    private final String symbol;

    public OrderRejected(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public OrderRejected(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
