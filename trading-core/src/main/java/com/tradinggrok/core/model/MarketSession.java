package com.tradinggrok.core.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * One regular trading session from the broker's calendar, in market-local time.
 * Early-close days carry their shortened close.
 */
public record MarketSession(LocalDate date, LocalTime open, LocalTime close) {
    public MarketSession {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(close, "close");
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("Session on " + date + " opens at " + open + " but closes at " + close);
        }
    }
}
