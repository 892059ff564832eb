package com.tradinggrok.execution;

import com.tradinggrok.api.AlpacaApiException;
import com.tradinggrok.api.ResilientAlpacaClient;
import com.tradinggrok.api.model.AlpacaAccount;
import com.tradinggrok.api.model.AlpacaOrder;
import com.tradinggrok.api.model.AlpacaPosition;
import com.tradinggrok.core.error.ExecutionUnavailable;
import com.tradinggrok.core.error.OrderRejected;
import com.tradinggrok.core.gateway.ExecutionGateway;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.BrokerOrder;
import com.tradinggrok.core.model.BrokerOrderStatus;
import com.tradinggrok.core.model.BrokerPosition;
import com.tradinggrok.core.model.MarketSession;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link ExecutionGateway} backed by the Alpaca trading API.
 *
 * <p>A broker answer refusing an order becomes {@link OrderRejected}. Anything else that goes
 * wrong (transport, 5xx, open breaker, rate limiter) becomes {@link ExecutionUnavailable}.
 */
public final class AlpacaExecutionGateway implements ExecutionGateway {
    private static final Logger logger = LoggerFactory.getLogger(AlpacaExecutionGateway.class);

    private final ResilientAlpacaClient client;
    private final Clock clock;

    public AlpacaExecutionGateway(ResilientAlpacaClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public OrderHandle submitOrder(OrderIntent intent) {
        String clientOrderId = "tg-" + intent.reason().label() + "-" + UUID.randomUUID();
        AlpacaOrder order;
        try {
            order = client.placeOrder(intent.symbol(), intent.quantity(), intent.side().wireValue(),
                intent.type().wireValue(), intent.limitPrice(), clientOrderId);
        } catch (AlpacaApiException e) {
            if (!e.isTransient()) {
                logger.warn("❌ Order rejected for {}: {} {}", intent.symbol(), e.getStatusCode(), e.getResponseBody());
                throw new OrderRejected(intent.symbol(),
                    "Broker rejected " + intent.side() + " " + intent.symbol() + ": " + e.getResponseBody(), e);
            }
            throw unavailable("placeOrder", e);
        } catch (RuntimeException e) {
            throw unavailable("placeOrder", e);
        }

        if (order == null || order.id() == null) {
            throw new ExecutionUnavailable("Broker acknowledged " + intent.symbol() + " without an order id");
        }
        if ("rejected".equalsIgnoreCase(order.status())) {
            throw new OrderRejected(intent.symbol(), "Broker rejected order " + order.id());
        }
        logger.info("📤 Order accepted: {} {} {} ({}), id {}", intent.side(), intent.quantity(), intent.symbol(),
            intent.reason().label(), order.id());
        return new OrderHandle(order.id(), intent.symbol(), intent.side(),
            order.submittedAt() != null ? order.submittedAt() : clock.instant());
    }

    @Override
    public AccountSnapshot getAccountSnapshot() {
        AlpacaAccount account = call("getAccount", client::getAccount);
        int openPositions = call("getPositions", client::getPositions).size();
        if (account.tradingBlocked()) {
            logger.warn("Trading is blocked on this account");
        }
        return new AccountSnapshot(
            orZero(account.equity()),
            orZero(account.buyingPower()),
            orZero(account.cash()),
            openPositions,
            clock.instant());
    }

    @Override
    public List<BrokerPosition> getOpenPositions() {
        return call("getPositions", client::getPositions).stream()
            .map(AlpacaExecutionGateway::toBrokerPosition)
            .toList();
    }

    @Override
    public boolean cancelOrder(OrderHandle handle) {
        return call("cancelOrder", () -> client.cancelOrder(handle.orderId()));
    }

    @Override
    public Optional<BrokerOrder> getOrder(String orderId) {
        return call("getOrder", () -> client.getOrder(orderId)).map(AlpacaExecutionGateway::toBrokerOrder);
    }

    @Override
    public List<BrokerOrder> getOpenOrders() {
        return call("getOpenOrders", client::getOpenOrders).stream()
            .map(AlpacaExecutionGateway::toBrokerOrder)
            .toList();
    }

    @Override
    public Optional<BigDecimal> getLatestPrice(String symbol) {
        return call("getLatestTradePrice", () -> client.getLatestTradePrice(symbol));
    }

    @Override
    public List<MarketSession> getMarketCalendar(LocalDate from, LocalDate until) {
        return call("getCalendar", () -> client.getCalendar(from, until)).stream()
            .map(day -> new MarketSession(day.date(), day.open(), day.close()))
            .toList();
    }

    static BrokerPosition toBrokerPosition(AlpacaPosition position) {
        long quantity = position.quantity() == null ? 0 : position.quantity().longValue();
        if ("short".equalsIgnoreCase(position.side()) && quantity > 0) {
            quantity = -quantity;
        }
        return new BrokerPosition(position.symbol(), quantity, position.avgEntryPrice(), position.currentPrice());
    }

    static BrokerOrder toBrokerOrder(AlpacaOrder order) {
        return new BrokerOrder(
            order.id(),
            order.symbol(),
            "sell".equalsIgnoreCase(order.side()) ? OrderSide.SELL : OrderSide.BUY,
            order.quantity() == null ? 0 : order.quantity().longValue(),
            order.filledQuantity() == null ? 0 : order.filledQuantity().longValue(),
            order.filledAvgPrice(),
            mapStatus(order.status()),
            order.filledAt());
    }

    static BrokerOrderStatus mapStatus(String status) {
        if (status == null) {
            return BrokerOrderStatus.NEW;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "new", "accepted", "pending_new", "accepted_for_bidding", "held", "calculated",
                 "pending_replace", "pending_cancel", "replaced", "stopped", "suspended" -> BrokerOrderStatus.NEW;
            case "partially_filled" -> BrokerOrderStatus.PARTIALLY_FILLED;
            case "filled" -> BrokerOrderStatus.FILLED;
            case "canceled", "done_for_day" -> BrokerOrderStatus.CANCELED;
            case "expired" -> BrokerOrderStatus.EXPIRED;
            case "rejected" -> BrokerOrderStatus.REJECTED;
            default -> {
                logger.warn("Unknown Alpaca order status '{}', treating as working", status);
                yield BrokerOrderStatus.NEW;
            }
        };
    }

    private static <T> T call(String operation, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw unavailable(operation, e);
        }
    }

    private static ExecutionUnavailable unavailable(String operation, RuntimeException cause) {
        return new ExecutionUnavailable("Alpaca " + operation + " failed: " + cause.getMessage(), cause);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
