package com.tradinggrok.core.model;

import java.util.Locale;

public enum RecommendedAction {
    BUY,
    SELL,
    HOLD;

    /** Lenient parse for provider output; anything unrecognised is HOLD. */
    public static RecommendedAction parse(String raw) {
        if (raw == null) {
            return HOLD;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "BUY" -> BUY;
            case "SELL" -> SELL;
            default -> HOLD;
        };
    }
}
