package com.tradinggrok.core.ledger;

import com.tradinggrok.core.model.BrokerOrder;
import com.tradinggrok.core.model.BrokerOrderStatus;
import com.tradinggrok.core.model.BrokerPosition;
import com.tradinggrok.core.model.ExecutionSnapshot;
import com.tradinggrok.core.model.Fill;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.OrderSide;
import com.tradinggrok.core.model.PendingOrder;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.model.PositionStatus;
import com.tradinggrok.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-process mirror of positions, at most one active (PENDING_ENTRY, OPEN, PENDING_EXIT) per symbol.
 * The broker is the system of record for fills; {@link #reconcile} moves the ledger toward it.
 *
 * <p>Thread-safety: a single writer (the orchestrator loop). Active positions are read lock-free
 * through ConcurrentHashMap; the bounded history and inconsistency logs are copied under their own lock.
 */
public final class PositionLedger {
    private static final Logger logger = LoggerFactory.getLogger(PositionLedger.class);
    static final int DEFAULT_HISTORY_LIMIT = 500;

    private final Set<String> trackedSymbols;
    private final Function<BigDecimal, Thresholds> thresholdCalculator;
    private final Duration pendingOrderTimeout;

    private final ConcurrentHashMap<String, Position> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingOrder> pendingOrders = new ConcurrentHashMap<>();
    private final int historyLimit;
    private final Deque<Position> history = new ArrayDeque<>();
    private final Deque<LedgerInconsistency> inconsistencies = new ArrayDeque<>();
    private volatile BigDecimal realizedPnl = BigDecimal.ZERO;
    private volatile int inconsistencyCount;

    /**
     * @param trackedSymbols      broker positions in these symbols are adopted when the ledger has no record of them
     * @param thresholdCalculator derives stop-loss and take-profit from a confirmed fill price
     * @param pendingOrderTimeout how long a submission with unknown outcome may stay pending
     */
    public PositionLedger(Collection<String> trackedSymbols,
                          Function<BigDecimal, Thresholds> thresholdCalculator,
                          Duration pendingOrderTimeout) {
        this(trackedSymbols, thresholdCalculator, pendingOrderTimeout, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * @param historyLimit how many closed or voided positions, and how many inconsistencies, are retained
     */
    public PositionLedger(Collection<String> trackedSymbols,
                          Function<BigDecimal, Thresholds> thresholdCalculator,
                          Duration pendingOrderTimeout,
                          int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be at least 1: " + historyLimit);
        }
        this.historyLimit = historyLimit;
        this.trackedSymbols = trackedSymbols.stream()
            .map(s -> s.toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.thresholdCalculator = thresholdCalculator;
        this.pendingOrderTimeout = pendingOrderTimeout;
    }

    // ========== Writes (loop thread only) ==========

    /**
     * Record an order the broker acknowledged, or whose outcome is unknown when {@code handle} is null.
     * An entry creates a PENDING_ENTRY position; an exit moves the OPEN position to PENDING_EXIT.
     */
    public Position recordSubmission(OrderIntent intent, OrderHandle handle, Instant at) {
        String symbol = intent.symbol();
        String orderId = handle != null ? handle.orderId() : null;
        Position current = active.get(symbol);
        Position next;

        if (intent.isEntry()) {
            if (current != null) {
                throw new IllegalStateException(symbol + ": already has an active position (" + current.status() + ")");
            }
            next = Position.pendingEntry(symbol, intent.quantity(), intent.referencePrice(),
                intent.thresholds(), orderId, at);
        } else {
            if (current == null) {
                throw new IllegalStateException(symbol + ": exit submitted without an active position");
            }
            next = current.exitSubmitted(orderId, intent.reason());
        }

        active.put(symbol, next);
        pendingOrders.put(symbol, new PendingOrder(intent, handle, at));
        logger.atInfo()
            .addKeyValue("symbol", symbol)
            .addKeyValue("side", intent.side())
            .addKeyValue("quantity", intent.quantity())
            .addKeyValue("reason", intent.reason().label())
            .addKeyValue("orderId", orderId)
            .log("Order recorded, position {}", next.status());
        return next;
    }

    /**
     * Apply a confirmed entry fill: PENDING_ENTRY becomes OPEN at the fill price and quantity,
     * with thresholds recomputed from the fill price.
     */
    public Position recordEntry(Fill fill) {
        Position current = requireActive(fill.symbol());
        Position opened = current.filled(fill.quantity(), fill.price(), thresholdCalculator.apply(fill.price()));
        active.put(opened.symbol(), opened);
        pendingOrders.remove(opened.symbol());
        logger.info("✅ {} entry filled: {} @ {} (stop {}, take {})", opened.symbol(), opened.quantity(),
            opened.entryPrice(), opened.stopLoss(), opened.takeProfit());
        return opened;
    }

    /**
     * Apply a confirmed exit fill: the position closes with realized P&L and moves to history.
     */
    public Position recordExit(Fill fill) {
        Position current = requireActive(fill.symbol());
        Position closed = current.closed(fill.price(), fill.filledAt());
        retire(closed);
        logger.atInfo()
            .addKeyValue("symbol", closed.symbol())
            .addKeyValue("exitPrice", fill.price())
            .addKeyValue("realizedPnl", closed.realizedPnl())
            .addKeyValue("reason", closed.exitReason() != null ? closed.exitReason().label() : "external")
            .log("🏁 Position closed");
        return closed;
    }

    /**
     * Update mark prices of held positions. Symbols without a price keep their previous mark.
     */
    public void markToMarket(Map<String, BigDecimal> priceBySymbol) {
        for (Position position : List.copyOf(active.values())) {
            BigDecimal price = priceBySymbol.get(position.symbol());
            if (price != null && position.status().isHolding() && !price.equals(position.markPrice())) {
                active.put(position.symbol(), position.marked(price));
            }
        }
    }

    /**
     * Merge the broker's state into the ledger. Reconciling twice against the same snapshot
     * changes nothing the second time.
     *
     * @return number of positions that changed
     */
    public int reconcile(ExecutionSnapshot snapshot) {
        int changes = 0;
        for (Position position : List.copyOf(active.values())) {
            Position updated = switch (position.status()) {
                case PENDING_ENTRY -> reconcilePendingEntry(position, snapshot);
                case PENDING_EXIT -> reconcilePendingExit(position, snapshot);
                default -> reconcileOpen(position, snapshot);
            };
            if (!updated.equals(position)) {
                changes++;
            }
        }
        changes += adoptUntrackedPositions(snapshot);

        if (changes > 0) {
            logger.info("Reconciliation applied {} change(s): {} active, {} pending orders",
                changes, active.size(), pendingOrders.size());
        }
        return changes;
    }

    private Position reconcilePendingEntry(Position position, ExecutionSnapshot snapshot) {
        Optional<BrokerOrder> order = snapshot.order(position.orderId());
        if (order.isPresent()) {
            BrokerOrder brokerOrder = order.get();
            if (brokerOrder.hasFill()
                && (brokerOrder.status() == BrokerOrderStatus.FILLED || brokerOrder.status().isDead())) {
                // The opened position must already agree with the broker's holding in this pass.
                return reconcileOpen(recordEntry(brokerOrder.toFill(snapshot.takenAt())), snapshot);
            }
            if (brokerOrder.status().isDead()) {
                logger.warn("{} entry order {} ended {}, voiding", position.symbol(), brokerOrder.id(),
                    brokerOrder.status());
                return retire(position.voided(snapshot.takenAt()));
            }
            return position;
        }

        Optional<BrokerPosition> held = snapshot.positionFor(position.symbol());
        if (held.isPresent() && held.get().quantity() > 0) {
            BrokerPosition brokerPosition = held.get();
            return recordEntry(new Fill(position.symbol(), OrderSide.BUY, brokerPosition.quantity(),
                brokerPosition.avgEntryPrice(), snapshot.takenAt(), position.orderId()));
        }
        if (snapshot.hasOpenOrder(position.symbol(), OrderSide.BUY)) {
            return position;
        }
        if (position.orderId() != null) {
            logger.warn("{} entry order {} unknown to broker, voiding", position.symbol(), position.orderId());
            return retire(position.voided(snapshot.takenAt()));
        }
        if (isExpired(position, snapshot.takenAt())) {
            logger.warn("{} unacknowledged entry expired after {}, voiding", position.symbol(), pendingOrderTimeout);
            return retire(position.voided(snapshot.takenAt()));
        }
        return position;
    }

    private Position reconcilePendingExit(Position position, ExecutionSnapshot snapshot) {
        Optional<BrokerPosition> held = snapshot.positionFor(position.symbol());
        Optional<BrokerOrder> order = snapshot.order(position.orderId());

        if (order.isPresent()) {
            BrokerOrder brokerOrder = order.get();
            if (brokerOrder.status() == BrokerOrderStatus.FILLED && brokerOrder.hasFill()) {
                return recordExit(brokerOrder.toFill(snapshot.takenAt()));
            }
            if (!brokerOrder.status().isDead()) {
                return position;
            }
            logger.warn("{} exit order {} ended {}", position.symbol(), brokerOrder.id(), brokerOrder.status());
        } else {
            if (held.isEmpty() && !snapshot.hasOpenOrder(position.symbol(), OrderSide.SELL)) {
                BigDecimal exitPrice = position.markPrice() != null ? position.markPrice() : position.entryPrice();
                logger.warn("{} no longer held at broker, closing at last mark {}", position.symbol(), exitPrice);
                return recordExit(new Fill(position.symbol(), OrderSide.SELL, position.quantity(), exitPrice,
                    snapshot.takenAt(), position.orderId()));
            }
            if (snapshot.hasOpenOrder(position.symbol(), OrderSide.SELL)) {
                return position;
            }
            if (position.orderId() == null && !isExpired(position, snapshot.takenAt())) {
                return position;
            }
        }

        if (held.isEmpty()) {
            BigDecimal exitPrice = position.markPrice() != null ? position.markPrice() : position.entryPrice();
            return recordExit(new Fill(position.symbol(), OrderSide.SELL, position.quantity(), exitPrice,
                snapshot.takenAt(), position.orderId()));
        }
        Position reopened = position.exitNotFilled();
        active.put(reopened.symbol(), reopened);
        pendingOrders.remove(reopened.symbol());
        logger.warn("{} exit not filled, back to OPEN for re-evaluation", reopened.symbol());
        return reconcileOpen(reopened, snapshot);
    }

    private Position reconcileOpen(Position position, ExecutionSnapshot snapshot) {
        Optional<BrokerPosition> held = snapshot.positionFor(position.symbol());
        if (held.isEmpty()) {
            LedgerInconsistency inconsistency = new LedgerInconsistency(position.id(), position.symbol(),
                position.quantity(), "OPEN position not held at broker", snapshot.takenAt());
            synchronized (inconsistencies) {
                inconsistencies.addLast(inconsistency);
                if (inconsistencies.size() > historyLimit) {
                    inconsistencies.removeFirst();
                }
                inconsistencyCount++;
            }
            logger.error("❌ Ledger inconsistency: {} x{} is OPEN in the ledger but absent at the broker, voiding",
                position.symbol(), position.quantity());
            return retire(position.voided(snapshot.takenAt()));
        }
        long brokerQuantity = held.get().quantity();
        if (brokerQuantity > 0 && brokerQuantity != position.quantity()) {
            Position resized = position.withQuantity(brokerQuantity);
            active.put(resized.symbol(), resized);
            logger.warn("{} quantity adjusted to broker: {} -> {}", position.symbol(), position.quantity(),
                brokerQuantity);
            return resized;
        }
        return position;
    }

    private int adoptUntrackedPositions(ExecutionSnapshot snapshot) {
        int adopted = 0;
        for (BrokerPosition brokerPosition : snapshot.positions()) {
            String symbol = brokerPosition.symbol().toUpperCase(Locale.ROOT);
            if (active.containsKey(symbol) || brokerPosition.quantity() <= 0) {
                continue;
            }
            if (!trackedSymbols.contains(symbol)) {
                logger.debug("Skipping broker position {} - not in tracked symbols", symbol);
                continue;
            }
            Position position = Position.adopted(symbol, brokerPosition.quantity(), brokerPosition.avgEntryPrice(),
                thresholdCalculator.apply(brokerPosition.avgEntryPrice()), brokerPosition.currentPrice(),
                snapshot.takenAt());
            active.put(symbol, position);
            adopted++;
            logger.info("Adopted broker position: {} - {} shares @ {} (stop {}, take {})", symbol,
                position.quantity(), position.entryPrice(), position.stopLoss(), position.takeProfit());
        }
        return adopted;
    }

    /**
     * Replace the ledger contents with persisted state. Only active positions are accepted.
     */
    public void restore(List<Position> positions, List<PendingOrder> orders) {
        active.clear();
        pendingOrders.clear();
        for (Position position : positions) {
            if (!position.isActive()) {
                throw new IllegalArgumentException("Cannot restore " + position.status() + " position " + position.id());
            }
            if (active.putIfAbsent(position.symbol(), position) != null) {
                throw new IllegalArgumentException("Duplicate active position for " + position.symbol());
            }
        }
        for (PendingOrder order : orders) {
            pendingOrders.put(order.symbol(), order);
        }
        logger.info("Ledger restored: {} active positions, {} pending orders", active.size(), pendingOrders.size());
    }

    private Position retire(Position terminal) {
        active.remove(terminal.symbol());
        pendingOrders.remove(terminal.symbol());
        synchronized (history) {
            history.addLast(terminal);
            if (history.size() > historyLimit) {
                history.removeFirst();
            }
            if (terminal.realizedPnl() != null) {
                realizedPnl = realizedPnl.add(terminal.realizedPnl());
            }
        }
        return terminal;
    }

    private Position requireActive(String symbol) {
        Position current = active.get(symbol.toUpperCase(Locale.ROOT));
        if (current == null) {
            throw new IllegalStateException(symbol + ": no active position");
        }
        return current;
    }

    private boolean isExpired(Position position, Instant now) {
        PendingOrder pending = pendingOrders.get(position.symbol());
        Instant since = pending != null ? pending.submittedAt() : position.entryTime();
        return now.isAfter(since.plus(pendingOrderTimeout));
    }

    // ========== Reads (any thread) ==========

    public Optional<Position> activePosition(String symbol) {
        return Optional.ofNullable(active.get(symbol.toUpperCase(Locale.ROOT)));
    }

    public int activeCount() {
        return active.size();
    }

    /** Positions with shares held at the broker (OPEN or PENDING_EXIT). */
    public int holdingCount() {
        return (int) active.values().stream().filter(p -> p.status().isHolding()).count();
    }

    public List<Position> activePositions() {
        return active.values().stream()
            .sorted(Comparator.comparing(Position::symbol))
            .collect(Collectors.toUnmodifiableList());
    }

    public List<Position> positionsWithStatus(PositionStatus status) {
        return activePositions().stream()
            .filter(p -> p.status() == status)
            .collect(Collectors.toUnmodifiableList());
    }

    /** Active positions followed by the retained closed and voided ones in the order they ended. */
    public List<Position> positions() {
        List<Position> all = new ArrayList<>(activePositions());
        all.addAll(history());
        return List.copyOf(all);
    }

    /** The most recent closed and voided positions, oldest first. */
    public List<Position> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public List<PendingOrder> pendingOrders() {
        return pendingOrders.values().stream()
            .sorted(Comparator.comparing(PendingOrder::submittedAt))
            .collect(Collectors.toUnmodifiableList());
    }

    /** The most recent inconsistencies, oldest first. */
    public List<LedgerInconsistency> inconsistencies() {
        synchronized (inconsistencies) {
            return List.copyOf(inconsistencies);
        }
    }

    /** Inconsistencies detected since start, including ones no longer retained. */
    public int inconsistencyCount() {
        return inconsistencyCount;
    }

    /** Realized P&L of every position closed since start, including ones no longer retained. */
    public BigDecimal realizedPnl() {
        return realizedPnl;
    }

    public BigDecimal unrealizedPnl() {
        return active.values().stream()
            .map(Position::unrealizedPnl)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
