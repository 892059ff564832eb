package com.tradinggrok.core.orchestrator;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.engine.Decision;
import com.tradinggrok.core.engine.DecisionEngine;
import com.tradinggrok.core.error.AnalysisUnavailable;
import com.tradinggrok.core.error.ClockMisconfiguration;
import com.tradinggrok.core.error.ExecutionUnavailable;
import com.tradinggrok.core.error.NotInEmergencyState;
import com.tradinggrok.core.error.OrderRejected;
import com.tradinggrok.core.error.RiskLimitExceeded;
import com.tradinggrok.core.error.TradingException;
import com.tradinggrok.core.gateway.AnalysisGateway;
import com.tradinggrok.core.gateway.ExecutionGateway;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.market.TradingClock;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.BrokerOrder;
import com.tradinggrok.core.model.BrokerPosition;
import com.tradinggrok.core.model.ExecutionSnapshot;
import com.tradinggrok.core.model.IntentReason;
import com.tradinggrok.core.model.MarketSession;
import com.tradinggrok.core.model.MarketContext;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.PendingOrder;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.model.PositionStatus;
import com.tradinggrok.core.model.Recommendation;
import com.tradinggrok.core.persistence.LedgerStateStore;
import com.tradinggrok.core.persistence.PersistedState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

/**
 * Owns the trading cycle, the emergency stop and the status surface.
 *
 * <p>Ledger writes and order submissions happen only on the thread that calls {@link #tick} and
 * {@link #awaitCommand} (see {@link OrchestratorLoop}). Control requests from other threads change the
 * state atomically and post a {@link ControlCommand}; the loop performs the follow-up work.
 * Gateway calls run on a bounded worker pool and are abandoned after their configured timeout.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);
    private static final int GATEWAY_POOL_SIZE = 4;
    private static final int CALENDAR_DAYS_AHEAD = 14;

    private final TradingConfig config;
    private final PositionLedger ledger;
    private final DecisionEngine engine;
    private final AnalysisGateway analysisGateway;
    private final ExecutionGateway executionGateway;
    private final LedgerStateStore stateStore;
    private final MeterRegistry meterRegistry;
    private final Clock wallClock;
    private final ExecutorService gatewayExecutor;

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.STOPPED);
    private final BlockingQueue<ControlCommand> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicInteger consecutiveExecutionFailures = new AtomicInteger();
    private final AtomicLong skippedCycles = new AtomicLong();

    private volatile TradingClock clock;
    private volatile Instant lastCycleTime;
    private volatile AccountSnapshot lastAccount;
    private volatile String lastError;
    private volatile String emergencyReason;
    private volatile Recommendation lastRecommendation;
    private volatile LocalDate calendarLoadedFor;

    private final Timer cycleTimer;
    private final Counter skippedCycleCounter;
    private final Counter policyViolationCounter;
    private final Counter emergencyStopCounter;
    private final Counter executionFailureCounter;
    private final Counter analysisFailureCounter;

    public Orchestrator(TradingConfig config, PositionLedger ledger, DecisionEngine engine,
                        AnalysisGateway analysisGateway, ExecutionGateway executionGateway,
                        LedgerStateStore stateStore, MeterRegistry meterRegistry, Clock wallClock) {
        this.config = config;
        this.ledger = ledger;
        this.engine = engine;
        this.analysisGateway = analysisGateway;
        this.executionGateway = executionGateway;
        this.stateStore = stateStore;
        this.meterRegistry = meterRegistry;
        this.wallClock = wallClock;
        this.gatewayExecutor = Executors.newFixedThreadPool(GATEWAY_POOL_SIZE, runnable -> {
            Thread thread = new Thread(runnable, "gateway-call");
            thread.setDaemon(true);
            return thread;
        });

        this.cycleTimer = Timer.builder("trading.cycle.duration")
            .description("Time spent in one trading cycle")
            .register(meterRegistry);
        this.skippedCycleCounter = meterRegistry.counter("trading.cycle.skipped");
        this.policyViolationCounter = meterRegistry.counter("trading.policy.violations");
        this.emergencyStopCounter = meterRegistry.counter("trading.emergency.stops");
        this.executionFailureCounter = meterRegistry.counter("trading.execution.failures");
        this.analysisFailureCounter = meterRegistry.counter("trading.analysis.failures");
        Gauge.builder("trading.positions.open", ledger, PositionLedger::holdingCount)
            .description("Positions with shares held at the broker")
            .register(meterRegistry);
    }

    // ========== Lifecycle ==========

    /**
     * Validate the trading window, restore persisted state and enter RUNNING, or EMERGENCY_STOPPED
     * when the previous run ended emergency-stopped.
     *
     * @throws ClockMisconfiguration if the window settings are invalid; the orchestrator stays STOPPED
     */
    public void start() {
        if (state.get() != OrchestratorState.STOPPED) {
            throw new IllegalStateException("Orchestrator already started: " + state.get());
        }
        try {
            this.clock = new TradingClock(config);
        } catch (ClockMisconfiguration e) {
            lastError = e.getMessage();
            logger.error("❌ Refusing to start: {}", e.getMessage());
            throw e;
        }

        OrchestratorState initial = OrchestratorState.RUNNING;
        Optional<PersistedState> persisted = stateStore.load();
        if (persisted.isPresent()) {
            ledger.restore(persisted.get().positions(), persisted.get().pendingOrders());
            if (persisted.get().orchestratorState() == OrchestratorState.EMERGENCY_STOPPED) {
                initial = OrchestratorState.EMERGENCY_STOPPED;
                emergencyReason = "emergency stop carried over from previous run";
                logger.error("🚨 Previous run ended emergency-stopped; staying stopped until resumed");
            }
        }

        state.set(initial);
        persist();
        logger.info("🚀 Orchestrator started in {} ({} mode, {} symbols, {} active positions)", initial,
            config.isPaperTrading() ? "PAPER" : "LIVE", config.getWatchlist().size(), ledger.activeCount());
    }

    /**
     * Enter STOPPED and wake the loop so it exits. An emergency stop survives into the persisted state.
     */
    public void stop() {
        OrchestratorState previous = state.getAndSet(OrchestratorState.STOPPED);
        commands.offer(new ControlCommand.Shutdown(wallClock.instant()));
        if (previous != OrchestratorState.STOPPED) {
            persist();
            logger.info("Orchestrator stopped (was {})", previous);
        }
    }

    @Override
    public void close() {
        gatewayExecutor.shutdownNow();
    }

    // ========== Loop ==========

    /**
     * One loop iteration: process queued commands, run a cycle (or a liquidation pass while
     * emergency-stopped) when inside the trading window, and return when the loop should wake next.
     */
    public Instant tick(Instant now) {
        refreshCalendarIfStale(now);
        int handled = drainCommands();
        OrchestratorState current = state.get();
        if (current == OrchestratorState.RUNNING && clock.isTradingWindow(now)) {
            runCycle(now);
        } else if (current == OrchestratorState.EMERGENCY_STOPPED && handled == 0 && ledger.activeCount() > 0) {
            runLiquidationPass(now);
        }
        drainCommands();
        return clock.nextWakeTime(now);
    }

    /**
     * Block until a control command arrives or {@code timeout} elapses, then handle the command.
     *
     * @return true if a command was handled
     */
    public boolean awaitCommand(Duration timeout) throws InterruptedException {
        ControlCommand command = commands.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        if (command == null) {
            return false;
        }
        handleCommand(command);
        return true;
    }

    /**
     * Load the broker's session calendar once per market day. On failure the configured weekday and
     * holiday rules stay in effect and the load is retried on the next tick.
     */
    private void refreshCalendarIfStale(Instant now) {
        TradingClock current = clock;
        LocalDate today = now.atZone(current.getZone()).toLocalDate();
        if (today.equals(calendarLoadedFor)) {
            return;
        }
        LocalDate until = today.plusDays(CALENDAR_DAYS_AHEAD);
        try {
            List<MarketSession> sessions = callExecution("getMarketCalendar",
                () -> executionGateway.getMarketCalendar(today, until));
            if (sessions == null || sessions.isEmpty()) {
                logger.warn("Broker returned no market sessions for {} to {}, keeping configured calendar", today, until);
                return;
            }
            this.clock = current.withSessions(today, until, sessions);
            calendarLoadedFor = today;
        } catch (ExecutionUnavailable e) {
            logger.warn("Market calendar unavailable, keeping configured calendar: {}", e.getMessage());
        }
    }

    private int drainCommands() {
        int handled = 0;
        ControlCommand command;
        while ((command = commands.poll()) != null) {
            handleCommand(command);
            handled++;
        }
        return handled;
    }

    private void handleCommand(ControlCommand command) {
        if (command instanceof ControlCommand.EmergencyStop stop) {
            liquidateAll(stop.reason(), stop.requestedAt());
        } else if (command instanceof ControlCommand.Resume) {
            persist();
        } else {
            logger.debug("Shutdown command received");
        }
    }

    // ========== Cycle ==========

    /**
     * Reconcile, mark to market, then evaluate every tracked symbol in isolation. A call that
     * overlaps a cycle already in flight is skipped and counted, never queued.
     */
    public CycleReport runCycle(Instant now) {
        if (state.get() != OrchestratorState.RUNNING) {
            return CycleReport.skipped(now, CycleReport.Outcome.SKIPPED_NOT_RUNNING, "state is " + state.get());
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            long skipped = skippedCycles.incrementAndGet();
            skippedCycleCounter.increment();
            logger.warn("⏭️ Cycle at {} skipped: previous cycle still in flight ({} skipped so far)", now, skipped);
            return CycleReport.skipped(now, CycleReport.Outcome.SKIPPED_OVERLAP, "previous cycle still in flight");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ExecutionSnapshot snapshot;
            try {
                snapshot = takeSnapshot(now);
            } catch (ExecutionUnavailable e) {
                onExecutionFailure(e);
                return CycleReport.skipped(now, CycleReport.Outcome.ABORTED, "reconciliation failed: " + e.getMessage());
            }

            ledger.reconcile(snapshot);
            Map<String, BigDecimal> marks = markPrices(snapshot);
            ledger.markToMarket(marks);

            Map<String, Decision> decisions = new LinkedHashMap<>();
            for (String symbol : symbolsToEvaluate()) {
                if (state.get() != OrchestratorState.RUNNING) {
                    logger.warn("Cycle cut short by emergency stop before {}", symbol);
                    break;
                }
                decisions.put(symbol, evaluateSymbol(symbol, snapshot.account(), marks, now));
            }

            lastCycleTime = now;
            persist();
            CycleReport report = new CycleReport(now, CycleReport.Outcome.COMPLETED, decisions, null);
            logger.info("🔄 Cycle {} complete: {} symbols, {} orders, {} active positions", now,
                decisions.size(), report.ordersSubmitted(), ledger.activeCount());
            return report;
        } finally {
            sample.stop(cycleTimer);
            cycleInFlight.set(false);
        }
    }

    private ExecutionSnapshot takeSnapshot(Instant now) {
        AccountSnapshot account = callExecution("getAccountSnapshot", executionGateway::getAccountSnapshot);
        if (account == null) {
            throw new ExecutionUnavailable("execution backend returned no account snapshot");
        }
        List<BrokerOrder> openOrders = callExecution("getOpenOrders", executionGateway::getOpenOrders);
        Map<String, BrokerOrder> ordersById = new HashMap<>();
        for (PendingOrder pending : ledger.pendingOrders()) {
            if (pending.isAcknowledged()) {
                String orderId = pending.handle().orderId();
                callExecution("getOrder", () -> executionGateway.getOrder(orderId))
                    .ifPresent(order -> ordersById.put(order.id(), order));
            }
        }
        List<BrokerPosition> positions = callExecution("getOpenPositions", executionGateway::getOpenPositions);
        onExecutionSuccess();
        lastAccount = account;
        return new ExecutionSnapshot(account, positions, ordersById, openOrders, now);
    }

    private Map<String, BigDecimal> markPrices(ExecutionSnapshot snapshot) {
        Map<String, BigDecimal> marks = new HashMap<>();
        for (BrokerPosition position : snapshot.positions()) {
            if (position.currentPrice() != null) {
                marks.put(position.symbol().toUpperCase(Locale.ROOT), position.currentPrice());
            }
        }
        return marks;
    }

    private Set<String> symbolsToEvaluate() {
        Set<String> symbols = new LinkedHashSet<>(config.getWatchlist());
        for (Position position : ledger.activePositions()) {
            symbols.add(position.symbol());
        }
        return symbols;
    }

    private Decision evaluateSymbol(String symbol, AccountSnapshot account, Map<String, BigDecimal> marks,
                                    Instant now) {
        Optional<Position> held = ledger.activePosition(symbol);
        if (held.isPresent() && held.get().status() != PositionStatus.OPEN) {
            return new Decision.Hold(symbol, "awaiting broker confirmation (" + held.get().status() + ")");
        }
        try {
            BigDecimal price = marks.get(symbol);
            if (price == null) {
                price = latestPrice(symbol);
            }
            MarketContext context = new MarketContext(symbol, now, price, held.isPresent(), account.equity());
            Recommendation recommendation = requestRecommendation(symbol, context);

            Decision decision = engine.evaluate(symbol, recommendation, price, ledger, account, now,
                state.get() == OrchestratorState.RUNNING);
            Optional<OrderIntent> intent = decision.orderIntent();
            if (intent.isEmpty()) {
                return decision;
            }
            return submit(intent.get(), decision, now);
        } catch (RiskLimitExceeded e) {
            policyViolationCounter.increment();
            logger.warn("⚠️ Policy violation, intent dropped: {}", e.getMessage());
            return new Decision.Hold(symbol, "risk limit exceeded: " + e.getMessage());
        } catch (RuntimeException e) {
            lastError = symbol + ": " + e.getMessage();
            logger.error("{} evaluation failed, holding for this cycle", symbol, e);
            return new Decision.Hold(symbol, "evaluation failed: " + e.getMessage());
        }
    }

    private BigDecimal latestPrice(String symbol) {
        try {
            Optional<BigDecimal> price = callExecution("getLatestPrice", () -> executionGateway.getLatestPrice(symbol));
            onExecutionSuccess();
            return price.orElse(null);
        } catch (ExecutionUnavailable e) {
            onExecutionFailure(e);
            return null;
        }
    }

    private Recommendation requestRecommendation(String symbol, MarketContext context) {
        try {
            Recommendation recommendation = callWithTimeout("getRecommendation(" + symbol + ")",
                () -> analysisGateway.getRecommendation(symbol, context), config.getAnalysisTimeout(),
                (message, cause) -> new AnalysisUnavailable(symbol, message, cause));
            if (recommendation != null) {
                lastRecommendation = recommendation;
            }
            return recommendation;
        } catch (AnalysisUnavailable e) {
            analysisFailureCounter.increment();
            logger.warn("{} analysis unavailable, treating as HOLD: {}", symbol, e.getMessage());
            return null;
        }
    }

    private Decision submit(OrderIntent intent, Decision decision, Instant now) {
        String symbol = intent.symbol();
        if (intent.isEntry() && state.get() != OrchestratorState.RUNNING) {
            logger.warn("{} entry dropped before submission: emergency stop in progress", symbol);
            return new Decision.Hold(symbol, "entries suspended");
        }
        try {
            OrderHandle handle = callExecution("submitOrder", () -> executionGateway.submitOrder(intent));
            onExecutionSuccess();
            if (intent.isEntry() && state.get() != OrchestratorState.RUNNING) {
                logger.warn("{} entry acknowledged during emergency stop, cancelling order {}", symbol, handle.orderId());
                if (tryCancel(handle)) {
                    return new Decision.Hold(symbol, "entry cancelled by emergency stop");
                }
            }
            ledger.recordSubmission(intent, handle, now);
            countSubmitted(intent);
            return decision;
        } catch (OrderRejected e) {
            meterRegistry.counter("trading.orders.rejected", "reason", intent.reason().label()).increment();
            logger.warn("❌ {} {} order rejected: {}", symbol, intent.side(), e.getMessage());
            return new Decision.Hold(symbol, "order rejected: " + e.getMessage());
        } catch (ExecutionUnavailable e) {
            onExecutionFailure(e);
            ledger.recordSubmission(intent, null, now);
            countSubmitted(intent);
            logger.warn("{} {} submission outcome unknown, left pending for reconciliation: {}", symbol,
                intent.side(), e.getMessage());
            return decision;
        }
    }

    private void countSubmitted(OrderIntent intent) {
        meterRegistry.counter("trading.orders.submitted",
            "side", intent.side().wireValue(), "reason", intent.reason().label()).increment();
    }

    // ========== Emergency stop ==========

    /**
     * Flip to EMERGENCY_STOPPED immediately and ask the loop to liquidate. Safe from any thread.
     */
    public Acknowledgement triggerEmergencyStop(String reason) {
        Instant at = wallClock.instant();
        OrchestratorState previous = state.getAndUpdate(
            s -> s == OrchestratorState.RUNNING ? OrchestratorState.EMERGENCY_STOPPED : s);
        if (previous == OrchestratorState.EMERGENCY_STOPPED) {
            logger.warn("Emergency stop already active, ignoring duplicate request: {}", reason);
            return new Acknowledgement(false, previous, "already emergency-stopped", at);
        }
        if (previous == OrchestratorState.STOPPED) {
            return new Acknowledgement(false, previous, "orchestrator is not running", at);
        }

        emergencyReason = reason;
        emergencyStopCounter.increment();
        logger.error("🚨 EMERGENCY STOP: {} 🚨", reason);
        commands.offer(new ControlCommand.EmergencyStop(reason, at));
        return new Acknowledgement(true, OrchestratorState.EMERGENCY_STOPPED,
            "emergency stop accepted, liquidating " + ledger.holdingCount() + " position(s)", at);
    }

    /**
     * Leave EMERGENCY_STOPPED and allow entries again.
     *
     * @throws NotInEmergencyState if the orchestrator is not emergency-stopped
     */
    public Acknowledgement resume() {
        Instant at = wallClock.instant();
        if (!state.compareAndSet(OrchestratorState.EMERGENCY_STOPPED, OrchestratorState.RUNNING)) {
            throw new NotInEmergencyState(state.get().name());
        }
        consecutiveExecutionFailures.set(0);
        emergencyReason = null;
        commands.offer(new ControlCommand.Resume(at));
        logger.warn("▶️ Trading resumed by operator");
        return new Acknowledgement(true, OrchestratorState.RUNNING, "trading resumed", at);
    }

    private void liquidateAll(String reason, Instant at) {
        logger.error("STEP 1: Cancelling pending entry orders ({})", reason);
        for (PendingOrder pending : ledger.pendingOrders()) {
            if (pending.intent().isEntry() && pending.isAcknowledged()) {
                tryCancel(pending.handle());
            }
        }
        logger.error("STEP 2: Liquidating {} open position(s)", ledger.positionsWithStatus(PositionStatus.OPEN).size());
        liquidateOpenPositions(at);
        persist();
    }

    /**
     * While emergency-stopped: reconcile so liquidation fills are confirmed, and re-issue liquidation
     * for positions whose exit did not fill.
     */
    private void runLiquidationPass(Instant now) {
        try {
            ledger.reconcile(takeSnapshot(now));
        } catch (ExecutionUnavailable e) {
            lastError = "reconciliation during emergency stop failed: " + e.getMessage();
            logger.error("Reconciliation during emergency stop failed: {}", e.getMessage());
            return;
        }
        liquidateOpenPositions(now);
        persist();
    }

    private void liquidateOpenPositions(Instant at) {
        for (Position position : ledger.positionsWithStatus(PositionStatus.OPEN)) {
            BigDecimal reference = position.markPrice() != null ? position.markPrice() : position.entryPrice();
            OrderIntent intent = OrderIntent.exit(position.symbol(), position.quantity(), reference,
                IntentReason.EMERGENCY);
            try {
                OrderHandle handle = callExecution("submitOrder", () -> executionGateway.submitOrder(intent));
                ledger.recordSubmission(intent, handle, at);
                countSubmitted(intent);
                logger.warn("Liquidation order {} placed: SELL {} x{}", handle.orderId(), position.symbol(),
                    position.quantity());
            } catch (OrderRejected e) {
                lastError = "liquidation of " + position.symbol() + " rejected: " + e.getMessage();
                logger.error("❌ Liquidation of {} rejected, will retry: {}", position.symbol(), e.getMessage());
            } catch (ExecutionUnavailable e) {
                ledger.recordSubmission(intent, null, at);
                lastError = "liquidation of " + position.symbol() + " outcome unknown: " + e.getMessage();
                logger.error("Liquidation of {} outcome unknown, left pending: {}", position.symbol(), e.getMessage());
            }
        }
    }

    private boolean tryCancel(OrderHandle handle) {
        try {
            boolean cancelled = callExecution("cancelOrder", () -> executionGateway.cancelOrder(handle));
            logger.warn("Cancel {} order {}: {}", handle.symbol(), handle.orderId(), cancelled ? "done" : "not cancellable");
            return cancelled;
        } catch (ExecutionUnavailable e) {
            lastError = "cancel of " + handle.orderId() + " failed: " + e.getMessage();
            logger.error("Failed to cancel {} order {}: {}", handle.symbol(), handle.orderId(), e.getMessage());
            return false;
        }
    }

    // ========== Gateway calls ==========

    private void onExecutionSuccess() {
        consecutiveExecutionFailures.set(0);
    }

    private void onExecutionFailure(ExecutionUnavailable e) {
        int failures = consecutiveExecutionFailures.incrementAndGet();
        int threshold = config.getMaxConsecutiveExecutionFailures();
        executionFailureCounter.increment();
        lastError = e.getMessage();
        logger.error("Execution backend failure {}/{}: {}", failures, threshold, e.getMessage());
        if (failures >= threshold && state.get() == OrchestratorState.RUNNING) {
            triggerEmergencyStop("execution backend unavailable: " + failures + " consecutive failures");
        }
    }

    private <T> T callExecution(String operation, Callable<T> call) {
        return callWithTimeout(operation, call, config.getExecutionTimeout(), ExecutionUnavailable::new);
    }

    private <T> T callWithTimeout(String operation, Callable<T> call, Duration timeout,
                                  BiFunction<String, Throwable, ? extends TradingException> onFailure) {
        Future<T> future;
        try {
            future = gatewayExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            throw onFailure.apply(operation + " rejected: gateway pool shut down", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onFailure.apply(operation + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TradingException tradingException) {
                throw tradingException;
            }
            throw onFailure.apply(operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw onFailure.apply(operation + " interrupted", e);
        }
    }

    // ========== Persistence ==========

    private void persist() {
        try {
            stateStore.save(new PersistedState(persistedState(), ledger.activePositions(), ledger.pendingOrders(),
                wallClock.instant()));
        } catch (UncheckedIOException e) {
            lastError = "state not persisted: " + e.getMessage();
            logger.error("Failed to persist ledger state", e);
        }
    }

    private OrchestratorState persistedState() {
        OrchestratorState current = state.get();
        if (current == OrchestratorState.STOPPED && emergencyReason != null) {
            return OrchestratorState.EMERGENCY_STOPPED;
        }
        return current;
    }

    // ========== Status (any thread, never blocks) ==========

    public OrchestratorStatus getStatus() {
        TradingClock currentClock = clock;
        Instant now = wallClock.instant();
        AccountSnapshot account = lastAccount;
        return new OrchestratorStatus(
            state.get(),
            lastCycleTime,
            ledger.holdingCount(),
            ledger.activeCount(),
            ledger.pendingOrders().size(),
            account != null ? account.equity() : null,
            currentClock != null && currentClock.isTradingWindow(now),
            currentClock != null ? currentClock.sessionPhase(now) : null,
            consecutiveExecutionFailures.get(),
            skippedCycles.get(),
            ledger.inconsistencyCount(),
            lastError,
            emergencyReason,
            config.isPaperTrading(),
            ledger.realizedPnl(),
            ledger.unrealizedPnl(),
            lastRecommendation);
    }

    /**
     * Account as of the last successful reconciliation, empty before the first one.
     */
    public Optional<AccountSnapshot> getAccount() {
        return Optional.ofNullable(lastAccount);
    }

    public OrchestratorState getState() {
        return state.get();
    }

    public List<Position> getPositions() {
        return ledger.positions();
    }

    public List<PendingOrder> getOpenOrders() {
        return ledger.pendingOrders();
    }

    public PositionLedger getLedger() {
        return ledger;
    }
}
