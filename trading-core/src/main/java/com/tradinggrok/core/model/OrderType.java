package com.tradinggrok.core.model;

import java.util.Locale;

public enum OrderType {
    MARKET,
    LIMIT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
