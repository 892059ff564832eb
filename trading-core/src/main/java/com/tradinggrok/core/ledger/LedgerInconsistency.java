package com.tradinggrok.core.ledger;

import java.time.Instant;

/**
 * The ledger believed a position existed that the broker does not hold.
 */
public record LedgerInconsistency(String positionId, String symbol, long quantity, String detail, Instant detectedAt) {
}
