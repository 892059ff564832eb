package com.tradinggrok.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything reconciliation needs from the broker, read at one instant.
 *
 * @param ordersById broker records for the orders the ledger is waiting on
 * @param openOrders every order still working at the broker
 */
public record ExecutionSnapshot(
    AccountSnapshot account,
    List<BrokerPosition> positions,
    Map<String, BrokerOrder> ordersById,
    List<BrokerOrder> openOrders,
    Instant takenAt
) {
    public ExecutionSnapshot {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(takenAt, "takenAt");
        positions = positions == null ? List.of() : List.copyOf(positions);
        ordersById = ordersById == null ? Map.of() : Map.copyOf(ordersById);
        openOrders = openOrders == null ? List.of() : List.copyOf(openOrders);
    }

    public Optional<BrokerPosition> positionFor(String symbol) {
        return positions.stream()
            .filter(p -> p.symbol().equalsIgnoreCase(symbol) && p.quantity() != 0)
            .findFirst();
    }

    public Optional<BrokerOrder> order(String orderId) {
        return orderId == null ? Optional.empty() : Optional.ofNullable(ordersById.get(orderId));
    }

    public boolean hasOpenOrder(String symbol, OrderSide side) {
        return openOrders.stream()
            .anyMatch(o -> o.symbol().equalsIgnoreCase(symbol) && o.side() == side && o.status().isOpen());
    }
}
