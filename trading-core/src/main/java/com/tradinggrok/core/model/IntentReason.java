package com.tradinggrok.core.model;

/**
 * Why an order intent was produced. Exit reasons are listed in evaluation priority.
 */
public enum IntentReason {
    ENTRY("entry"),
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT("take_profit"),
    SIGNAL("signal"),
    EMERGENCY("emergency");

    private final String label;

    IntentReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
