package com.tradinggrok.core.orchestrator;

import com.tradinggrok.core.market.TradingClock.SessionPhase;
import com.tradinggrok.core.model.Recommendation;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view for the control surface.
 */
public record OrchestratorStatus(
    OrchestratorState state,
    Instant lastCycleTime,
    int openPositions,
    int activePositions,
    int pendingOrders,
    BigDecimal lastEquity,
    boolean inTradingWindow,
    SessionPhase sessionPhase,
    int consecutiveExecutionFailures,
    long skippedCycles,
    int inconsistencyCount,
    String lastError,
    String emergencyReason,
    boolean paperTrading,
    BigDecimal realizedPnl,
    BigDecimal unrealizedPnl,
    Recommendation lastRecommendation
) {
}
