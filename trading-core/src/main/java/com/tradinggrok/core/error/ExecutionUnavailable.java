package com.tradinggrok.core.error;

/**
 * The execution backend could not be reached or did not answer in time.
 * Unlike {@link OrderRejected}, the outcome of the call is unknown.
 */
public class ExecutionUnavailable extends TradingException {

    public ExecutionUnavailable(String message) {
        super(message);
    }

    public ExecutionUnavailable(String message, Throwable cause) {
        super(message, cause);
    }
}
