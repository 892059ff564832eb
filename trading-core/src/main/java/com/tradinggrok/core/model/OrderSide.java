package com.tradinggrok.core.model;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
