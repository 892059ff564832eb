package com.tradinggrok.api.controller;

import com.tradinggrok.core.orchestrator.Acknowledgement;
import com.tradinggrok.core.orchestrator.Orchestrator;
import com.tradinggrok.validation.EmergencyStopRequest;
import io.javalin.Javalin;
import io.javalin.http.Context;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Operator endpoints over the orchestrator: status, account, positions, orders, emergency stop and resume.
 */
public final class ControlController {
    private static final Logger logger = LoggerFactory.getLogger(ControlController.class);
    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final Orchestrator orchestrator;

    public ControlController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public void registerRoutes(Javalin app) {
        app.get("/api/status", this::getStatus);
        app.get("/api/account", this::getAccount);
        app.get("/api/positions", this::getPositions);
        app.get("/api/orders", this::getOrders);
        app.post("/api/emergency-stop", this::emergencyStop);
        app.post("/api/resume", this::resume);
    }

    void getStatus(Context ctx) {
        ctx.json(orchestrator.getStatus());
    }

    /**
     * Account as of the last reconciliation; 503 until the first cycle has reached the broker.
     */
    void getAccount(Context ctx) {
        var account = orchestrator.getAccount();
        if (account.isEmpty()) {
            ctx.status(503);
            ctx.json(Map.of("message", "no account snapshot yet"));
            return;
        }
        ctx.json(account.get());
    }

    void getPositions(Context ctx) {
        ctx.json(orchestrator.getPositions());
    }

    void getOrders(Context ctx) {
        ctx.json(orchestrator.getOpenOrders());
    }

    void emergencyStop(Context ctx) {
        var body = ctx.body();
        var request = body == null || body.isBlank()
            ? new EmergencyStopRequest(ctx.queryParam("reason"))
            : ctx.bodyAsClass(EmergencyStopRequest.class);

        var violations = validator.validate(request);
        if (!violations.isEmpty()) {
            var errors = violations.stream()
                .map(v -> Map.of(
                    "field", v.getPropertyPath().toString(),
                    "message", v.getMessage()))
                .toList();
            ctx.status(400);
            ctx.json(Map.of("accepted", false, "errors", errors));
            return;
        }

        logger.error("🚨 EMERGENCY STOP REQUESTED FROM CONTROL API: {} 🚨", request.reasonOrDefault());
        Acknowledgement ack = orchestrator.triggerEmergencyStop(request.reasonOrDefault());
        ctx.status(ack.accepted() ? 202 : 409);
        ctx.json(ack);
    }

    /**
     * Propagates {@code NotInEmergencyState}; the server maps it to 409.
     */
    void resume(Context ctx) {
        logger.warn("Resume requested from control API");
        ctx.json(orchestrator.resume());
    }
}
