package com.tradinggrok.dashboard;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradinggrok.api.controller.ControlController;
import com.tradinggrok.core.error.NotInEmergencyState;
import com.tradinggrok.core.orchestrator.Orchestrator;
import com.tradinggrok.core.orchestrator.OrchestratorState;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.UnauthorizedResponse;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON control surface. {@code /api/*} requires HTTP basic auth as {@code admin};
 * {@code /health} and {@code /metrics} are open.
 */
public final class ControlApiServer {
    private static final Logger logger = LoggerFactory.getLogger(ControlApiServer.class);
    static final String ADMIN_USER = "admin";

    private final Javalin app;
    private final Orchestrator orchestrator;
    private final byte[] passwordBytes;
    private final Supplier<String> circuitState;

    /**
     * @param metricsScraper Prometheus text for {@code /metrics}
     * @param circuitState broker circuit breaker state reported by {@code /health}
     */
    public ControlApiServer(Orchestrator orchestrator, String dashboardPassword,
                            Supplier<String> metricsScraper, Supplier<String> circuitState) {
        if (dashboardPassword == null || dashboardPassword.isBlank()) {
            throw new IllegalArgumentException("Control API requires a dashboard password");
        }
        this.orchestrator = orchestrator;
        this.passwordBytes = dashboardPassword.getBytes(StandardCharsets.UTF_8);
        this.circuitState = circuitState;

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;

            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));

            javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(it -> {
                it.reflectClientOrigin = true;
                it.allowCredentials = true;
            }));
        });

        app.before("/api/*", this::requireAdmin);

        app.exception(NotInEmergencyState.class, (e, ctx) -> {
            ctx.status(409);
            ctx.json(Map.of("accepted", false, "state", e.getCurrentState(), "message", e.getMessage()));
        });

        new ControlController(orchestrator).registerRoutes(app);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metricsScraper.get());
        });

        app.get("/health", this::health);
    }

    private void requireAdmin(Context ctx) {
        var credentials = ctx.basicAuthCredentials();
        boolean authorized = credentials != null
            && ADMIN_USER.equals(credentials.getUsername())
            && MessageDigest.isEqual(passwordBytes, credentials.getPassword().getBytes(StandardCharsets.UTF_8));
        if (!authorized) {
            logger.warn("Unauthorized control API request: {} {}", ctx.method(), ctx.path());
            ctx.header("WWW-Authenticate", "Basic realm=\"trading-grok\"");
            throw new UnauthorizedResponse();
        }
    }

    private void health(Context ctx) {
        var state = orchestrator.getState();
        String status = switch (state) {
            case RUNNING -> "UP";
            case EMERGENCY_STOPPED -> "DEGRADED";
            case STOPPED -> "DOWN";
        };
        int httpStatus = state == OrchestratorState.STOPPED ? 503 : 200;

        var body = new LinkedHashMap<String, Object>();
        body.put("status", status);
        body.put("orchestrator", state.name());
        body.put("broker_circuit", circuitState.get());
        ctx.status(httpStatus);
        ctx.json(body);
    }

    public void start(int port) {
        app.start(port);
        logger.info("🚀 Control API started at http://localhost:{}", app.port());
        logger.info("   REST API: http://localhost:{}/api/*", app.port());
        logger.info("   Health: http://localhost:{}/health", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    /**
     * Bound port; differs from the requested one when started on port 0.
     */
    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Control API stopped");
    }
}
