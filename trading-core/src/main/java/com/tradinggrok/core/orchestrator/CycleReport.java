package com.tradinggrok.core.orchestrator;

import com.tradinggrok.core.engine.Decision;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one {@code runCycle} call.
 *
 * @param decisions effective decision per evaluated symbol, in evaluation order
 */
public record CycleReport(Instant startedAt, Outcome outcome, Map<String, Decision> decisions, String detail) {

    public enum Outcome {
        COMPLETED,
        SKIPPED_OVERLAP,
        SKIPPED_NOT_RUNNING,
        ABORTED
    }

    public CycleReport {
        decisions = decisions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
    }

    static CycleReport skipped(Instant at, Outcome outcome, String detail) {
        return new CycleReport(at, outcome, Map.of(), detail);
    }

    public long ordersSubmitted() {
        return decisions.values().stream().filter(d -> d.orderIntent().isPresent()).count();
    }

    public Decision decision(String symbol) {
        return decisions.get(symbol);
    }
}
