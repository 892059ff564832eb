package com.tradinggrok.metrics;

import com.tradinggrok.api.ResilientAlpacaClient;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide Prometheus registry. The orchestrator and the Alpaca client record into
 * {@link #getRegistry()}; the control API serves {@link #scrape()} on {@code /metrics}.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;

    private MetricsService() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        logger.info("MetricsService initialized with Prometheus registry");
    }

    // Initialization-on-demand holder; class loading makes it thread-safe
    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus text exposition of every registered meter.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Expose the Alpaca circuit breaker as a gauge: 0 closed, 1 half-open, 2 open, 3 other.
     */
    public void monitorCircuitBreaker(ResilientAlpacaClient client) {
        Gauge.builder("alpaca.circuit.state", client, MetricsService::circuitStateValue)
            .description("Alpaca API circuit breaker state")
            .register(registry);
    }

    static double circuitStateValue(ResilientAlpacaClient client) {
        return switch (client.getCircuitBreakerState()) {
            case "CLOSED" -> 0;
            case "HALF_OPEN" -> 1;
            case "OPEN" -> 2;
            default -> 3;
        };
    }
}
