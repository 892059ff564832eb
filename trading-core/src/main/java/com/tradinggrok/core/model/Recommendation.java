package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Advice from the analysis provider. Untrusted input: the engine never takes sizing or
 * thresholds from it, only the action and confidence.
 */
public record Recommendation(
    String symbol,
    RecommendedAction action,
    double confidence,
    BigDecimal targetPrice,     // optional
    BigDecimal stopPrice,       // optional
    String reasoning,
    Instant timestamp
) {
    public Recommendation {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        symbol = symbol.toUpperCase(Locale.ROOT);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }
}
