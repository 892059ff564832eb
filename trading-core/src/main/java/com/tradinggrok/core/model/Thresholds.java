package com.tradinggrok.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Stop-loss and take-profit pair derived from an entry price.
 */
public record Thresholds(BigDecimal stopLoss, BigDecimal takeProfit) {
    public Thresholds {
        Objects.requireNonNull(stopLoss, "stopLoss");
        Objects.requireNonNull(takeProfit, "takeProfit");
        if (stopLoss.compareTo(takeProfit) >= 0) {
            throw new IllegalArgumentException("Stop-loss " + stopLoss + " must be below take-profit " + takeProfit);
        }
    }

    /** True when stop &lt; price &lt; take. */
    public boolean brackets(BigDecimal price) {
        return stopLoss.compareTo(price) < 0 && price.compareTo(takeProfit) < 0;
    }
}
