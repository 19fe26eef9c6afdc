package com.marketloop.observability;

import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.event.TradeClosedEvent;
import com.marketloop.event.TradeOpenedEvent;
import com.marketloop.risk.DailyLossBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the trading loop.
 * <ul>
 *   <li><b>loop.scan.cycles</b> (counter) and <b>loop.scan.duration</b> (timer)</li>
 *   <li><b>loop.trades.approved</b> / <b>loop.trades.rejected</b> (counters)</li>
 *   <li><b>loop.orders.placed</b> / <b>loop.orders.failed</b> (counters)</li>
 *   <li><b>loop.trades.closed</b> (counter)</li>
 *   <li><b>loop.breaker.trips</b> (counter), <b>loop.breaker.latched</b> and <b>loop.daily.pnl</b> (gauges)</li>
 * </ul>
 *
 * <p>Rejections, trips and trade lifecycle counts come from application events;
 * the scan cycle and execution engine record the rest directly.
 */
@Service
public class LoopMetrics {

    private final Counter scanCycles;
    private final Counter tradesApproved;
    private final Counter tradesRejected;
    private final Counter ordersPlaced;
    private final Counter ordersFailed;
    private final Counter tradesClosed;
    private final Counter breakerTrips;
    private final Timer scanDuration;

    public LoopMetrics(MeterRegistry meterRegistry, DailyLossBreaker dailyLossBreaker) {
        this.scanCycles = Counter.builder("loop.scan.cycles")
                .description("Completed scan-and-trade cycles")
                .register(meterRegistry);
        this.tradesApproved = Counter.builder("loop.trades.approved")
                .description("Candidates approved by the risk gate")
                .register(meterRegistry);
        this.tradesRejected = Counter.builder("loop.trades.rejected")
                .description("Candidates rejected by the risk gate")
                .register(meterRegistry);
        this.ordersPlaced = Counter.builder("loop.orders.placed")
                .description("Entry orders accepted and recorded")
                .register(meterRegistry);
        this.ordersFailed = Counter.builder("loop.orders.failed")
                .description("Entry or exit orders that failed or were rejected")
                .register(meterRegistry);
        this.tradesClosed = Counter.builder("loop.trades.closed")
                .description("Trades finalized by the position monitor")
                .register(meterRegistry);
        this.breakerTrips = Counter.builder("loop.breaker.trips")
                .description("Daily loss breaker latches")
                .register(meterRegistry);
        this.scanDuration = Timer.builder("loop.scan.duration")
                .description("Wall time of one scan-and-trade cycle")
                .maximumExpectedValue(Duration.ofMinutes(2))
                .register(meterRegistry);

        meterRegistry.gauge("loop.breaker.latched", dailyLossBreaker, breaker -> breaker.isLatched() ? 1.0 : 0.0);
        meterRegistry.gauge("loop.daily.pnl", dailyLossBreaker, breaker -> breaker.getDailyRealizedPnl()
                .doubleValue());
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.TRADE_REJECTED) {
            tradesRejected.increment();
        } else if (event.getEventType() == RiskEventType.DAILY_LOSS_LIMIT_BREACH) {
            breakerTrips.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onTradeOpened(TradeOpenedEvent event) {
        ordersPlaced.increment();
    }

    @EventListener
    @Order(20)
    public void onTradeClosed(TradeClosedEvent event) {
        tradesClosed.increment();
    }

    public void recordScanCycle(Duration elapsed) {
        scanCycles.increment();
        scanDuration.record(elapsed);
    }

    public void recordApproval() {
        tradesApproved.increment();
    }

    public void recordOrderFailure() {
        ordersFailed.increment();
    }
}
