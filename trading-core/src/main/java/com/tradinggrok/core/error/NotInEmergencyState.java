package com.tradinggrok.core.error;

/**
 * Raised by resume when the orchestrator is not emergency-stopped.
 */
public class NotInEmergencyState extends TradingException {
    private final String currentState;

    public NotInEmergencyState(String currentState) {
        super("Cannot resume: orchestrator is " + currentState + ", not EMERGENCY_STOPPED");
        this.currentState = currentState;
    }

    public String getCurrentState() {
        return currentState;
    }
}
