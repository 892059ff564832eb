package com.tradinggrok.bot;

import com.tradinggrok.analysis.GrokAnalysisGateway;
import com.tradinggrok.analysis.GrokClient;
import com.tradinggrok.api.AlpacaClient;
import com.tradinggrok.api.ResilientAlpacaClient;
import com.tradinggrok.config.Config;
import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.engine.DecisionEngine;
import com.tradinggrok.core.error.ClockMisconfiguration;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.orchestrator.Orchestrator;
import com.tradinggrok.core.orchestrator.OrchestratorLoop;
import com.tradinggrok.core.persistence.LedgerStateStore;
import com.tradinggrok.core.risk.RiskPolicy;
import com.tradinggrok.dashboard.ControlApiServer;
import com.tradinggrok.execution.AlpacaExecutionGateway;
import com.tradinggrok.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;

/**
 * Process entry point. Runs the orchestrator loop and, unless started with {@code bot-only},
 * the control API.
 */
public final class TradingBot {
    private static final Logger logger = LoggerFactory.getLogger(TradingBot.class);
    private static final String BOT_ONLY = "bot-only";

    private TradingBot() {
    }

    public static void main(String[] args) {
        boolean serveApi = !Arrays.asList(args).contains(BOT_ONLY);

        var config = new Config();
        try {
            if (serveApi) {
                config.validate(Config.ControlApi.class);
            } else {
                config.validate();
            }
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        TradingConfig tradingConfig = TradingConfig.load().withPaperTrading(config.isPaperTrading());
        Clock clock = Clock.systemUTC();
        var metrics = MetricsService.getInstance();

        var alpaca = new ResilientAlpacaClient(new AlpacaClient(config), metrics.getRegistry());
        metrics.monitorCircuitBreaker(alpaca);
        var executionGateway = new AlpacaExecutionGateway(alpaca, clock);
        var analysisGateway = new GrokAnalysisGateway(new GrokClient(config), clock);

        var riskPolicy = new RiskPolicy(tradingConfig);
        var ledger = new PositionLedger(tradingConfig.getWatchlist(), riskPolicy::computeThresholds,
            tradingConfig.getPendingOrderTimeout());
        var orchestrator = new Orchestrator(tradingConfig, ledger, new DecisionEngine(tradingConfig, riskPolicy),
            analysisGateway, executionGateway, new LedgerStateStore(tradingConfig.getStateFile()),
            metrics.getRegistry(), clock);
        var loop = new OrchestratorLoop(orchestrator, clock);

        try {
            loop.start();
        } catch (ClockMisconfiguration e) {
            logger.error("Trading window misconfigured: {}", e.getMessage());
            orchestrator.close();
            System.exit(1);
            return;
        }

        ControlApiServer server = null;
        if (serveApi) {
            server = new ControlApiServer(orchestrator, config.dashboardPassword(), metrics::scrape,
                alpaca::getCircuitBreakerState);
            server.start(config.dashboardPort());
        } else {
            logger.info("Running in bot-only mode, control API disabled");
        }

        final ControlApiServer runningServer = server;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping...");
            if (runningServer != null) {
                runningServer.stop();
            }
            if (loop.isRunning()) {
                loop.stop();
            }
        }, "shutdown-hook"));

        logger.info("TradingGrok started ({} mode, watching {})",
            tradingConfig.isPaperTrading() ? "PAPER" : "LIVE", tradingConfig.getWatchlist());
    }
}
