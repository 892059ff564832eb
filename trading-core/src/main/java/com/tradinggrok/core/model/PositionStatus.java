package com.tradinggrok.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link Position}.
 *
 * <pre>
 * PENDING_ENTRY -> OPEN | VOID
 * OPEN          -> PENDING_EXIT | CLOSED | VOID (broker lost the position)
 * PENDING_EXIT  -> CLOSED | OPEN (exit not filled)
 * </pre>
 */
public enum PositionStatus {
    PENDING_ENTRY,
    OPEN,
    PENDING_EXIT,
    CLOSED,
    VOID;

    public Set<PositionStatus> successors() {
        return switch (this) {
            case PENDING_ENTRY -> EnumSet.of(OPEN, VOID);
            case OPEN -> EnumSet.of(PENDING_EXIT, CLOSED, VOID);
            case PENDING_EXIT -> EnumSet.of(CLOSED, OPEN);
            case CLOSED, VOID -> EnumSet.noneOf(PositionStatus.class);
        };
    }

    public boolean canTransitionTo(PositionStatus next) {
        return successors().contains(next);
    }

    /** Counts against the position cap and blocks a second position in the same symbol. */
    public boolean isActive() {
        return this == PENDING_ENTRY || this == OPEN || this == PENDING_EXIT;
    }

    /** Shares are held at the broker. */
    public boolean isHolding() {
        return this == OPEN || this == PENDING_EXIT;
    }
}
