package com.marketloop.recovery;

import com.marketloop.config.LoopProperties;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.Position;
import com.marketloop.execution.ExecutionEngine;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.scheduler.TaskGuard;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown, run before other components stop:
 * <ol>
 *   <li>Stop accepting new task invocations</li>
 *   <li>Wait a bounded time for in-flight tasks</li>
 *   <li>Cancel resting quotes of market-making positions</li>
 * </ol>
 * Positions themselves stay open; the monitor picks them up again after restart.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final TaskGuard taskGuard;
    private final TradeLedgerService tradeLedgerService;
    private final ExecutionEngine executionEngine;
    private final LoopProperties loopProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            TaskGuard taskGuard,
            TradeLedgerService tradeLedgerService,
            ExecutionEngine executionEngine,
            LoopProperties loopProperties) {
        this.taskGuard = taskGuard;
        this.tradeLedgerService = tradeLedgerService;
        this.executionEngine = executionEngine;
        this.loopProperties = loopProperties;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            taskGuard.stopAccepting();
            awaitInFlightTasks();
            cancelMarketMakingQuotes();
            log.info("Graceful shutdown completed");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops first
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void awaitInFlightTasks() {
        try {
            if (taskGuard.awaitIdle(Duration.ofMillis(loopProperties.getShutdownWaitMs()))) {
                log.info("All in-flight tasks finished");
            } else {
                log.warn("Tasks still running after {} ms, continuing shutdown", loopProperties.getShutdownWaitMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight tasks");
        }
    }

    void cancelMarketMakingQuotes() {
        try {
            int cancelled = 0;
            for (Position position : tradeLedgerService.getOpenPositions()) {
                if (position.getStrategy() == StrategyType.MARKET_MAKING) {
                    cancelled += executionEngine.cancelRestingOrders(position.getMarketId());
                }
            }
            log.info("Cancelled {} resting market-making orders", cancelled);
        } catch (DataAccessException e) {
            log.warn("Could not read open positions during shutdown", e);
        }
    }
}
