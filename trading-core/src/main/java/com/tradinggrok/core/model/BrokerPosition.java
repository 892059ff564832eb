package com.tradinggrok.core.model;

import java.math.BigDecimal;

/**
 * Broker-side record of a holding.
 */
public record BrokerPosition(String symbol, long quantity, BigDecimal avgEntryPrice, BigDecimal currentPrice) {
}
