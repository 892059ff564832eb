package com.tradinggrok.api;

import com.tradinggrok.api.model.AlpacaAccount;
import com.tradinggrok.api.model.AlpacaCalendarDay;
import com.tradinggrok.api.model.AlpacaOrder;
import com.tradinggrok.api.model.AlpacaPosition;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Wraps {@link AlpacaClient} with a circuit breaker, a rate limiter, retries and call metrics.
 *
 * <p>Only transport failures, 429 and 5xx count as transient. Order placement is never retried,
 * since a lost response does not mean the order was not accepted.
 *
 * <p>Failures surface unchecked: {@link AlpacaApiException} when the broker answered,
 * {@link UncheckedIOException} for transport errors, and resilience4j's own exceptions when
 * the breaker or limiter refused the call.
 */
public final class ResilientAlpacaClient {
    private static final Logger logger = LoggerFactory.getLogger(ResilientAlpacaClient.class);

    private final AlpacaClient delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final MeterRegistry meterRegistry;

    @FunctionalInterface
    interface AlpacaCall<T> {
        T call() throws IOException, InterruptedException;
    }

    public ResilientAlpacaClient(AlpacaClient delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, Duration.ofMillis(500));
    }

    ResilientAlpacaClient(AlpacaClient delegate, MeterRegistry meterRegistry, Duration retryWait) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;

        // Rejections such as 403/422 are answers, not outages
        Predicate<Throwable> transientFailure = ResilientAlpacaClient::isTransient;

        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(5)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordException(transientFailure)
            .build();
        this.circuitBreaker = CircuitBreaker.of("alpaca-api", cbConfig);

        // Alpaca allows 200 requests/minute
        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(200)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofSeconds(5))
            .build();
        this.rateLimiter = RateLimiter.of("alpaca-api", rlConfig);

        var retryConfig = RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(retryWait)
            .retryOnException(transientFailure)
            .build();
        this.retry = Retry.of("alpaca-api", retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Circuit breaker state changed: {}", event.getStateTransition()));
        retry.getEventPublisher()
            .onRetry(event -> logger.debug("Retrying {} (attempt {}): {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        logger.info("ResilientAlpacaClient initialized with circuit breaker, rate limiter, and retry");
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof AlpacaApiException) {
            return ((AlpacaApiException) t).isTransient();
        }
        return t instanceof UncheckedIOException;
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    public AlpacaAccount getAccount() {
        return executeResilient("getAccount", true, delegate::getAccount);
    }

    public List<AlpacaPosition> getPositions() {
        return executeResilient("getPositions", true, delegate::getPositions);
    }

    public List<AlpacaOrder> getOpenOrders() {
        return executeResilient("getOpenOrders", true, delegate::getOpenOrders);
    }

    public Optional<AlpacaOrder> getOrder(String orderId) {
        return executeResilient("getOrder", true, () -> delegate.getOrder(orderId));
    }

    public AlpacaOrder placeOrder(String symbol, long qty, String side, String type,
                                  BigDecimal limitPrice, String clientOrderId) {
        return executeResilient("placeOrder", false,
            () -> delegate.placeOrder(symbol, qty, side, type, limitPrice, clientOrderId));
    }

    public boolean cancelOrder(String orderId) {
        return executeResilient("cancelOrder", true, () -> delegate.cancelOrder(orderId));
    }

    public Optional<BigDecimal> getLatestTradePrice(String symbol) {
        return executeResilient("getLatestTradePrice", true, () -> delegate.getLatestTradePrice(symbol));
    }

    public List<AlpacaCalendarDay> getCalendar(LocalDate start, LocalDate end) {
        return executeResilient("getCalendar", true, () -> delegate.getCalendar(start, end));
    }

    /**
     * Rate limit, then retry (when allowed), then circuit breaker, all timed.
     */
    private <T> T executeResilient(String operation, boolean retryable, AlpacaCall<T> call) {
        var timer = Timer.builder("alpaca.api.call")
            .tag("operation", operation)
            .register(meterRegistry);

        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, unchecked(call));
        if (retryable) {
            guarded = Retry.decorateSupplier(retry, guarded);
        }
        Supplier<T> decorated = RateLimiter.decorateSupplier(rateLimiter, guarded);

        return timer.record(() -> {
            try {
                T result = decorated.get();
                meterRegistry.counter("alpaca.api.success", "operation", operation).increment();
                return result;
            } catch (RuntimeException e) {
                meterRegistry.counter("alpaca.api.failure",
                    "operation", operation,
                    "error", e.getClass().getSimpleName()).increment();
                logger.warn("API call failed: {} - {}", operation, e.getMessage());
                throw e;
            }
        });
    }

    private static <T> Supplier<T> unchecked(AlpacaCall<T> call) {
        return () -> {
            try {
                return call.call();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted during Alpaca call", e);
            }
        };
    }
}
