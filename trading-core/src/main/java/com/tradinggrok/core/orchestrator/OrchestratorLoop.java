package com.tradinggrok.core.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The single thread that drives an {@link Orchestrator}: tick, then sleep until the next wake time
 * or until a control command arrives, whichever comes first.
 */
public final class OrchestratorLoop implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OrchestratorLoop.class);
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(30);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final Orchestrator orchestrator;
    private final Clock wallClock;
    private final ExecutorService loopExecutor;
    private volatile boolean running;

    public OrchestratorLoop(Orchestrator orchestrator, Clock wallClock) {
        this.orchestrator = orchestrator;
        this.wallClock = wallClock;
        this.loopExecutor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "orchestrator-loop"));
    }

    /**
     * Start the orchestrator and its loop thread.
     */
    public void start() {
        orchestrator.start();
        running = true;
        loopExecutor.submit(this::run);
    }

    private void run() {
        logger.info("Orchestrator loop started");
        while (running && orchestrator.getState() != OrchestratorState.STOPPED) {
            try {
                Instant wake = orchestrator.tick(wallClock.instant());
                Duration wait = Duration.between(wallClock.instant(), wake);
                if (wait.isNegative()) {
                    wait = Duration.ZERO;
                }
                logger.debug("Next wake at {} (in {}s)", wake, wait.toSeconds());
                orchestrator.awaitCommand(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.error("Orchestrator loop iteration failed, backing off {}s", ERROR_BACKOFF.toSeconds(), e);
                if (!backOff()) {
                    break;
                }
            }
        }
        logger.info("Orchestrator loop exited");
    }

    private boolean backOff() {
        try {
            orchestrator.awaitCommand(ERROR_BACKOFF);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            logger.error("Command handling failed during back-off", e);
            return true;
        }
    }

    /**
     * Stop the orchestrator, wait for the loop thread to finish and release the gateway pool.
     */
    public void stop() {
        running = false;
        orchestrator.stop();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(SHUTDOWN_GRACE.toSeconds(), TimeUnit.SECONDS)) {
                logger.warn("Loop thread did not finish within {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loopExecutor.shutdownNow();
        }
        orchestrator.close();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}
