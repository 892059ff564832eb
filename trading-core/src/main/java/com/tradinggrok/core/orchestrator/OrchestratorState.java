package com.tradinggrok.core.orchestrator;

/**
 * STOPPED -> RUNNING -> EMERGENCY_STOPPED | STOPPED; EMERGENCY_STOPPED -> RUNNING only through resume.
 */
public enum OrchestratorState {
    STOPPED,
    RUNNING,
    EMERGENCY_STOPPED
}
