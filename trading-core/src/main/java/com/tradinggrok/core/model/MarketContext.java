package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What the analysis provider is told about a symbol for the current cycle.
 *
 * @param lastPrice latest known price, null if unknown
 */
public record MarketContext(String symbol, Instant cycleTime, BigDecimal lastPrice,
                            boolean holdingPosition, BigDecimal accountEquity) {
}
