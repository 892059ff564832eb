package com.tradinggrok.core.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tradinggrok.core.model.PendingOrder;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.orchestrator.OrchestratorState;

import java.time.Instant;
import java.util.List;

/**
 * What survives a restart: the orchestrator state and every active position with its pending order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedState(
    OrchestratorState orchestratorState,
    List<Position> positions,
    List<PendingOrder> pendingOrders,
    Instant savedAt
) {
    public PersistedState {
        positions = positions == null ? List.of() : List.copyOf(positions);
        pendingOrders = pendingOrders == null ? List.of() : List.copyOf(pendingOrders);
    }
}
