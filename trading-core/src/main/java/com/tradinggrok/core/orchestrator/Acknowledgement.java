package com.tradinggrok.core.orchestrator;

import java.time.Instant;

/**
 * Immediate answer to a control request. The requested work itself happens on the loop thread.
 */
public record Acknowledgement(boolean accepted, OrchestratorState state, String message, Instant at) {
}
