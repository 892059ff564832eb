package com.tradinggrok.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one holding, long only. Every lifecycle transition returns a new instance
 * that replaces this one in the ledger; terminal positions are never reopened.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Position(
    String id,
    String symbol,
    long quantity,
    BigDecimal entryPrice,
    Instant entryTime,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    PositionStatus status,
    BigDecimal markPrice,       // null until the first mark
    BigDecimal realizedPnl,     // null until CLOSED
    String orderId,             // broker order currently working for this position, if any
    IntentReason exitReason,    // set once an exit is submitted
    Instant closedAt
) {
    public Position {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(entryPrice, "entryPrice");
        Objects.requireNonNull(entryTime, "entryTime");
        Objects.requireNonNull(stopLoss, "stopLoss");
        Objects.requireNonNull(takeProfit, "takeProfit");
        Objects.requireNonNull(status, "status");
        symbol = symbol.toUpperCase(Locale.ROOT);

        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive for long positions: " + quantity);
        }
        if (entryPrice.signum() <= 0) {
            throw new IllegalArgumentException("Entry price must be positive");
        }
        if (stopLoss.compareTo(entryPrice) >= 0) {
            throw new IllegalArgumentException("Stop-loss must be below entry price for long positions");
        }
        if (takeProfit.compareTo(entryPrice) <= 0) {
            throw new IllegalArgumentException("Take-profit must be above entry price for long positions");
        }
    }

    /**
     * A position whose entry order was acknowledged but not yet filled.
     */
    public static Position pendingEntry(String symbol, long quantity, BigDecimal referencePrice,
                                        Thresholds thresholds, String orderId, Instant submittedAt) {
        return new Position(UUID.randomUUID().toString(), symbol, quantity, referencePrice, submittedAt,
            thresholds.stopLoss(), thresholds.takeProfit(), PositionStatus.PENDING_ENTRY,
            null, null, orderId, null, null);
    }

    /**
     * A position confirmed by the broker without a preceding submission from this process.
     */
    public static Position adopted(String symbol, long quantity, BigDecimal avgEntryPrice,
                                   Thresholds thresholds, BigDecimal markPrice, Instant detectedAt) {
        return new Position(UUID.randomUUID().toString(), symbol, quantity, avgEntryPrice, detectedAt,
            thresholds.stopLoss(), thresholds.takeProfit(), PositionStatus.OPEN,
            markPrice, null, null, null, null);
    }

    /** (mark - entry) x quantity while shares are held, zero otherwise. */
    public BigDecimal unrealizedPnl() {
        if (markPrice == null || !status.isHolding()) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isStopLossHit(BigDecimal price) {
        return price.compareTo(stopLoss) <= 0;
    }

    public boolean isTakeProfitHit(BigDecimal price) {
        return price.compareTo(takeProfit) >= 0;
    }

    public Position filled(long filledQuantity, BigDecimal fillPrice, Thresholds thresholds) {
        requireTransition(PositionStatus.OPEN);
        return new Position(id, symbol, filledQuantity, fillPrice, entryTime,
            thresholds.stopLoss(), thresholds.takeProfit(), PositionStatus.OPEN,
            markPrice == null ? fillPrice : markPrice, null, null, null, null);
    }

    public Position exitSubmitted(String exitOrderId, IntentReason reason) {
        requireTransition(PositionStatus.PENDING_EXIT);
        return new Position(id, symbol, quantity, entryPrice, entryTime, stopLoss, takeProfit,
            PositionStatus.PENDING_EXIT, markPrice, null, exitOrderId, reason, null);
    }

    public Position exitNotFilled() {
        if (status != PositionStatus.PENDING_EXIT) {
            throw new IllegalStateException(symbol + ": cannot revert exit from " + status);
        }
        return new Position(id, symbol, quantity, entryPrice, entryTime, stopLoss, takeProfit,
            PositionStatus.OPEN, markPrice, null, null, null, null);
    }

    public Position closed(BigDecimal exitPrice, Instant at) {
        requireTransition(PositionStatus.CLOSED);
        BigDecimal pnl = exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));
        return new Position(id, symbol, quantity, entryPrice, entryTime, stopLoss, takeProfit,
            PositionStatus.CLOSED, exitPrice, pnl, orderId, exitReason, at);
    }

    public Position voided(Instant at) {
        requireTransition(PositionStatus.VOID);
        return new Position(id, symbol, quantity, entryPrice, entryTime, stopLoss, takeProfit,
            PositionStatus.VOID, markPrice, null, orderId, exitReason, at);
    }

    public Position marked(BigDecimal price) {
        return new Position(id, symbol, quantity, entryPrice, entryTime, stopLoss, takeProfit,
            status, price, realizedPnl, orderId, exitReason, closedAt);
    }

    public Position withQuantity(long newQuantity) {
        return new Position(id, symbol, newQuantity, entryPrice, entryTime, stopLoss, takeProfit,
            status, markPrice, realizedPnl, orderId, exitReason, closedAt);
    }

    private void requireTransition(PositionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(symbol + ": illegal transition " + status + " -> " + next);
        }
    }
}
