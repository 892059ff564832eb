package com.tradinggrok.core.error;

/**
 * Base type for every failure the trading engine distinguishes.
 * Unchecked, so gateway adapters can surface them through lambdas and executor futures.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
