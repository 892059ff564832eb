package com.tradinggrok.core.model;

public enum BrokerOrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    EXPIRED,
    REJECTED;

    /** Still working at the broker. */
    public boolean isOpen() {
        return this == NEW || this == PARTIALLY_FILLED;
    }

    /** Finished without a complete fill. */
    public boolean isDead() {
        return this == CANCELED || this == EXPIRED || this == REJECTED;
    }
}
