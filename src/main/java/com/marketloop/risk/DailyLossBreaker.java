package com.marketloop.risk;

import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.event.RiskLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Tracks realized PnL for the current UTC day and latches once the loss limit is hit.
 *
 * <p>Once latched, every later candidate that day is rejected. The latch clears only
 * when the UTC date rolls over or through {@link #reset(String)}. A reset also moves the
 * baseline to the current total, so only losses realized after the reset count toward
 * a new trip the same day.
 *
 * <p><b>Thread safety:</b> PnL is recorded from the monitor thread and read from the
 * scan thread. The running total is an {@link AtomicReference} updated with
 * {@code updateAndGet}; {@code currentDate} is volatile and the day roll is synchronized.
 */
@Component
public class DailyLossBreaker {

    private static final Logger log = LoggerFactory.getLogger(DailyLossBreaker.class);

    static final BigDecimal WARNING_REMAINING_FRACTION = new BigDecimal("0.25");

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final AtomicReference<BigDecimal> dailyRealizedPnl = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> resetBaseline = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicBoolean latched = new AtomicBoolean(false);
    private final AtomicBoolean warned = new AtomicBoolean(false);
    private volatile LocalDate currentDate;

    public DailyLossBreaker(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.currentDate = LocalDate.now(clock);
    }

    public void recordRealizedPnl(BigDecimal pnl) {
        rollDayIfNeeded();
        BigDecimal total = dailyRealizedPnl.updateAndGet(current -> current.add(pnl));
        log.debug("Recorded realized PnL {}, daily total {}", pnl, total);
    }

    /** Seeds today's total, e.g. from the ledger at startup. */
    public void restore(BigDecimal todayRealizedPnl) {
        rollDayIfNeeded();
        dailyRealizedPnl.set(todayRealizedPnl);
        log.info("Daily realized PnL restored: {}", todayRealizedPnl);
    }

    /**
     * Evaluates the limit and latches on breach.
     *
     * @return true when trading must stop for the day
     */
    public boolean evaluate(BigDecimal bankroll, BigDecimal limitPct) {
        rollDayIfNeeded();
        if (latched.get()) {
            return true;
        }

        BigDecimal limit = limitPct.multiply(bankroll).setScale(4, RoundingMode.HALF_UP);
        BigDecimal effectivePnl = getEffectivePnl();
        if (effectivePnl.compareTo(limit.negate()) <= 0) {
            if (latched.compareAndSet(false, true)) {
                log.error(
                        "Daily loss limit breached: pnl={} limit={} bankroll={}. New entries halted until next UTC day",
                        effectivePnl,
                        limit.negate(),
                        bankroll);
                applicationEventPublisher.publishEvent(new RiskEvent(
                        this,
                        RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                        RiskLevel.CRITICAL,
                        "Daily loss limit breached: " + effectivePnl,
                        Map.of("dailyPnl", effectivePnl, "limit", limit.negate())));
            }
            return true;
        }

        BigDecimal remaining = limit.add(effectivePnl);
        if (effectivePnl.signum() < 0
                && remaining.compareTo(limit.multiply(WARNING_REMAINING_FRACTION)) < 0
                && warned.compareAndSet(false, true)) {
            log.warn("Daily loss approaching limit: pnl={} limit={} remaining={}", effectivePnl, limit.negate(), remaining);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.DAILY_LOSS_LIMIT_APPROACH,
                    RiskLevel.WARNING,
                    "Daily loss approaching limit: " + effectivePnl,
                    Map.of("dailyPnl", effectivePnl, "remaining", remaining)));
        }
        return false;
    }

    public boolean isLatched() {
        rollDayIfNeeded();
        return latched.get();
    }

    /** Explicit operator override. */
    public void reset(String requestedBy) {
        rollDayIfNeeded();
        boolean wasLatched = latched.getAndSet(false);
        warned.set(false);
        resetBaseline.set(dailyRealizedPnl.get());
        log.warn("Daily loss breaker reset by {} (was latched: {}), baseline={}", requestedBy, wasLatched, resetBaseline.get());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.DAILY_LOSS_BREAKER_RESET,
                RiskLevel.WARNING,
                "Daily loss breaker reset by " + requestedBy,
                Map.of("wasLatched", wasLatched)));
    }

    public BigDecimal getDailyRealizedPnl() {
        rollDayIfNeeded();
        return dailyRealizedPnl.get();
    }

    /** Realized PnL counted toward the limit: today's total less any reset baseline. */
    public BigDecimal getEffectivePnl() {
        return dailyRealizedPnl.get().subtract(resetBaseline.get());
    }

    private void rollDayIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(currentDate)) {
            return;
        }
        synchronized (this) {
            if (!today.equals(currentDate)) {
                log.info("UTC day rolled to {}: clearing daily PnL {} and breaker latch {}", today, dailyRealizedPnl.get(), latched.get());
                dailyRealizedPnl.set(BigDecimal.ZERO);
                resetBaseline.set(BigDecimal.ZERO);
                latched.set(false);
                warned.set(false);
                currentDate = today;
            }
        }
    }
}
