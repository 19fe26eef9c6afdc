package com.marketloop.scheduler;

import com.marketloop.advisory.AdvisoryListener;
import com.marketloop.domain.enums.LoopTask;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.exception.BaseException;
import com.marketloop.monitor.PositionMonitor;
import com.marketloop.recommendation.RecommendationService;
import com.marketloop.recommendation.Recommender;
import com.marketloop.reflection.ReflectionWorker;
import com.marketloop.reporting.WeeklyReportService;
import com.marketloop.settings.SettingsService;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Entry points of the independently scheduled tasks. Each invocation takes a fresh
 * settings snapshot and runs under its {@link TaskGuard} marker.
 *
 * <p>A storage or exchange failure ends that invocation with an ERROR log; the next
 * one starts clean.
 */
@Component
public class LoopScheduler {

    private static final Logger log = LoggerFactory.getLogger(LoopScheduler.class);

    private final TaskGuard taskGuard;
    private final SettingsService settingsService;
    private final ScanCycle scanCycle;
    private final PositionMonitor positionMonitor;
    private final ReflectionWorker reflectionWorker;
    private final WeeklyReportService weeklyReportService;
    private final Recommender recommender;
    private final RecommendationService recommendationService;
    private final AdvisoryListener advisoryListener;
    private final Clock clock;

    public LoopScheduler(
            TaskGuard taskGuard,
            SettingsService settingsService,
            ScanCycle scanCycle,
            PositionMonitor positionMonitor,
            ReflectionWorker reflectionWorker,
            WeeklyReportService weeklyReportService,
            Recommender recommender,
            RecommendationService recommendationService,
            AdvisoryListener advisoryListener,
            Clock clock) {
        this.taskGuard = taskGuard;
        this.settingsService = settingsService;
        this.scanCycle = scanCycle;
        this.positionMonitor = positionMonitor;
        this.reflectionWorker = reflectionWorker;
        this.weeklyReportService = weeklyReportService;
        this.recommender = recommender;
        this.recommendationService = recommendationService;
        this.advisoryListener = advisoryListener;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${marketloop.loop.scan-interval-ms:60000}",
            initialDelayString = "${marketloop.loop.initial-delay-ms:10000}")
    public void scanAndTrade() {
        run(LoopTask.SCAN_AND_TRADE, scanCycle::run);
    }

    /** Runs while paused too, so exits keep working. */
    @Scheduled(
            fixedDelayString = "${marketloop.loop.monitor-interval-ms:30000}",
            initialDelayString = "${marketloop.loop.initial-delay-ms:10000}")
    public void monitorPositions() {
        run(LoopTask.POSITION_MONITOR, positionMonitor::monitorPositions);
    }

    @Scheduled(fixedDelayString = "${marketloop.loop.reflection-interval-ms:5000}")
    public void drainReflections() {
        run(LoopTask.REFLECTION_WORKER, config -> reflectionWorker.drain());
    }

    /** Daily backstop for the loss triggers; on Mondays also the weekly report. */
    @Scheduled(cron = "0 5 0 * * *", zone = "UTC")
    public void dailyReview() {
        run(LoopTask.DAILY_REVIEW, config -> {
            recommender.evaluateLossTriggers(config);
            if (LocalDate.now(clock).getDayOfWeek() == DayOfWeek.MONDAY) {
                weeklyReportService.generate().ifPresent(report -> recommender.onWeeklyReport(report, config));
            }
        });
    }

    @Scheduled(cron = "0 10 0 * * *", zone = "UTC")
    public void expireRecommendations() {
        run(LoopTask.RECOMMENDATION_EXPIRY, recommendationService::expireStale);
    }

    @Scheduled(
            fixedDelayString = "${marketloop.advisory.poll-interval-ms:60000}",
            initialDelayString = "${marketloop.loop.initial-delay-ms:10000}")
    public void listenForAdvisories() {
        run(LoopTask.ADVISORY_LISTENER, advisoryListener::poll);
    }

    private void run(LoopTask task, Consumer<ConfigSnapshot> body) {
        taskGuard.runExclusive(task, () -> {
            try {
                body.accept(settingsService.snapshot());
            } catch (DataAccessException e) {
                log.error("{} aborted by a storage failure, retrying next cycle: {}", task, e.getMessage(), e);
            } catch (BaseException e) {
                log.error("{} aborted: [{}] {}", task, e.getErrorCode().getCode(), e.getMessage(), e);
            }
        });
    }
}
