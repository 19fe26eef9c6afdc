package com.marketloop.recovery;

import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.entity.TradeEntity;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.reflection.ReasoningClient;
import com.marketloop.reflection.ReflectionQueue;
import com.marketloop.repository.jpa.TradeJpaRepository;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.settings.SettingsService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Startup sequence, run once the application is ready:
 * <ol>
 *   <li>Seed missing settings with their defaults</li>
 *   <li>Restore today's realized PnL into the daily loss breaker</li>
 *   <li>Re-queue closed trades that have no reflection yet</li>
 *   <li>Probe the reasoning service</li>
 * </ol>
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final SettingsService settingsService;
    private final TradeJpaRepository tradeJpaRepository;
    private final TradeLedgerService tradeLedgerService;
    private final DailyLossBreaker dailyLossBreaker;
    private final ReflectionQueue reflectionQueue;
    private final ReasoningClient reasoningClient;
    private final Clock clock;

    public StartupRecoveryService(
            SettingsService settingsService,
            TradeJpaRepository tradeJpaRepository,
            TradeLedgerService tradeLedgerService,
            DailyLossBreaker dailyLossBreaker,
            ReflectionQueue reflectionQueue,
            ReasoningClient reasoningClient,
            Clock clock) {
        this.settingsService = settingsService;
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeLedgerService = tradeLedgerService;
        this.dailyLossBreaker = dailyLossBreaker;
        this.reflectionQueue = reflectionQueue;
        this.reasoningClient = reasoningClient;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");
        RecoveryResult result =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            result.setSettingsSeeded(settingsService.seedDefaults());

            BigDecimal todayPnl = tradeJpaRepository.sumRealizedPnlSince(LocalDate.now(clock).atStartOfDay());
            dailyLossBreaker.restore(todayPnl);
            result.setRestoredDailyPnl(todayPnl);

            result.setOpenPositions(tradeLedgerService.getOpenPositions().size());

            List<TradeEntity> unreflected = tradeJpaRepository.findByStatusAndReflectedFalse(TradeStatus.CLOSED);
            int requeued = 0;
            for (TradeEntity trade : unreflected) {
                if (reflectionQueue.offer(trade.getId())) {
                    requeued++;
                }
            }
            result.setReflectionsRequeued(requeued);
            result.setSuccess(true);
        } catch (DataAccessException e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
        }

        result.setReasoningReachable(reasoningClient.probe());
        result.setDurationMs(System.currentTimeMillis() - result.getStartedAt());

        log.info(
                "Startup recovery {}: duration={}ms, settingsSeeded={}, dailyPnl={}, openPositions={}, "
                        + "reflectionsRequeued={}, reasoningReachable={}",
                result.isSuccess() ? "completed" : "failed",
                result.getDurationMs(),
                result.getSettingsSeeded(),
                result.getRestoredDailyPnl(),
                result.getOpenPositions(),
                result.getReflectionsRequeued(),
                result.isReasoningReachable());
        return result;
    }
}
