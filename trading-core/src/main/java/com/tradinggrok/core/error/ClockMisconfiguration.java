package com.tradinggrok.core.error;

/**
 * Trading window settings that cannot describe a valid session. Fatal at startup.
 */
public class ClockMisconfiguration extends TradingException {

    public ClockMisconfiguration(String message) {
        super(message);
    }

    public ClockMisconfiguration(String message, Throwable cause) {
        super(message, cause);
    }
}
