package com.tradinggrok.core.error;

/**
 * The analysis provider could not produce a usable recommendation (timeout, transport error,
 * malformed response). The affected symbol is treated as HOLD for the cycle.
 */
public class AnalysisUnavailable extends TradingException {
    private final String symbol;

    public AnalysisUnavailable(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public AnalysisUnavailable(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
