package com.tradinggrok.core.orchestrator;

import java.time.Instant;

/**
 * Discrete control messages posted by the control surface and consumed only by the orchestrator loop.
 */
public sealed interface ControlCommand permits ControlCommand.EmergencyStop, ControlCommand.Resume, ControlCommand.Shutdown {

    record EmergencyStop(String reason, Instant requestedAt) implements ControlCommand {}

    record Resume(Instant requestedAt) implements ControlCommand {}

    record Shutdown(Instant requestedAt) implements ControlCommand {}
}
