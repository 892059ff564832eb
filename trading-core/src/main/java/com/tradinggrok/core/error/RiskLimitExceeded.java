package com.tradinggrok.core.error;

/**
 * An order intent would break a risk bound. The intent is logged as a policy violation and dropped.
 */
public class RiskLimitExceeded extends TradingException {
    private final String symbol;

    public RiskLimitExceeded(String symbol, String message) {
        super(symbol + ": " + message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
