package com.marketloop.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class DailyLossBreakerTest {

    private static final BigDecimal BANKROLL = new BigDecimal("5000");
    private static final BigDecimal LIMIT_PCT = new BigDecimal("0.03");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MutableClock clock;
    private DailyLossBreaker dailyLossBreaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T22:00:00Z");
        dailyLossBreaker = new DailyLossBreaker(applicationEventPublisher, clock);
    }

    @Test
    @DisplayName("Loss short of the limit does not latch")
    void belowLimitDoesNotLatch() {
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-100"));

        assertThat(dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT)).isFalse();
        assertThat(dailyLossBreaker.isLatched()).isFalse();
    }

    @Test
    @DisplayName("Breach latches once and publishes a single CRITICAL event")
    void breachPublishesOnce() {
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-160"));

        assertThat(dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT)).isTrue();
        assertThat(dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT)).isTrue();

        ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
        verify(applicationEventPublisher, times(1)).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.DAILY_LOSS_LIMIT_BREACH);
    }

    @Test
    @DisplayName("Warns once when less than a quarter of the limit remains")
    void approachWarning() {
        // limit 150, remaining 30 < 37.5
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-120"));

        dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT);
        dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT);

        ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
        verify(applicationEventPublisher, times(1)).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.DAILY_LOSS_LIMIT_APPROACH);
    }

    @Test
    @DisplayName("UTC midnight clears both the total and the latch")
    void dayRollClears() {
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-200"));
        dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT);

        clock.advance(Duration.ofHours(3));

        assertThat(dailyLossBreaker.isLatched()).isFalse();
        assertThat(dailyLossBreaker.getDailyRealizedPnl()).isEqualByComparingTo("0");
        assertThat(dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT)).isFalse();
    }

    @Test
    @DisplayName("Reset clears the latch and only later losses count toward a new trip")
    void resetMovesBaseline() {
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-200"));
        dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT);

        dailyLossBreaker.reset("operator");
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-50"));

        assertThat(dailyLossBreaker.isLatched()).isFalse();
        assertThat(dailyLossBreaker.getEffectivePnl()).isEqualByComparingTo("-50");
        assertThat(dailyLossBreaker.evaluate(BANKROLL, LIMIT_PCT)).isFalse();

        ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
        verify(applicationEventPublisher, times(2)).publishEvent(captor.capture());
        List<RiskEvent> events = captor.getAllValues();
        assertThat(events.get(1).getEventType()).isEqualTo(RiskEventType.DAILY_LOSS_BREAKER_RESET);
    }

    @Test
    @DisplayName("Restore seeds the running total")
    void restoreSeedsTotal() {
        dailyLossBreaker.restore(new BigDecimal("-75.50"));
        dailyLossBreaker.recordRealizedPnl(new BigDecimal("-10"));

        assertThat(dailyLossBreaker.getDailyRealizedPnl()).isEqualByComparingTo("-85.50");
    }
}
