package com.tradinggrok.core.gateway;

import com.tradinggrok.core.error.ExecutionUnavailable;
import com.tradinggrok.core.error.OrderRejected;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.BrokerOrder;
import com.tradinggrok.core.model.BrokerPosition;
import com.tradinggrok.core.model.MarketSession;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Brokerage operations the engine depends on. The broker is the system of record for fills.
 *
 * <p>Every method may throw {@link ExecutionUnavailable} when the backend cannot be reached
 * or the outcome of the call is unknown.
 */
public interface ExecutionGateway {

    /**
     * @return the broker's acknowledgement; the order may still be unfilled
     * @throws OrderRejected if the broker refused the order
     */
    OrderHandle submitOrder(OrderIntent intent) throws OrderRejected, ExecutionUnavailable;

    AccountSnapshot getAccountSnapshot() throws ExecutionUnavailable;

    List<BrokerPosition> getOpenPositions() throws ExecutionUnavailable;

    /**
     * @return true if the broker accepted the cancel request, false if the order was no longer cancellable
     */
    boolean cancelOrder(OrderHandle handle) throws ExecutionUnavailable;

    Optional<BrokerOrder> getOrder(String orderId) throws ExecutionUnavailable;

    List<BrokerOrder> getOpenOrders() throws ExecutionUnavailable;

    Optional<BigDecimal> getLatestPrice(String symbol) throws ExecutionUnavailable;

    /**
     * Regular sessions between {@code from} and {@code until} inclusive. Dates without a session are closed.
     */
    List<MarketSession> getMarketCalendar(LocalDate from, LocalDate until) throws ExecutionUnavailable;
}
