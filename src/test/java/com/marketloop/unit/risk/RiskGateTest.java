package com.marketloop.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeDecision;
import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.risk.PositionSizer;
import com.marketloop.risk.RiskGate;
import com.marketloop.settings.SettingKey;
import com.marketloop.support.Fixtures;
import com.marketloop.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for RiskGate with the real sizer and loss breaker: Kelly sizing and the
 * ceiling clamp, liquidity, exposure and correlation limits, and the daily loss latch.
 */
@ExtendWith(MockitoExtension.class)
class RiskGateTest {

    private static final BigDecimal BANKROLL = new BigDecimal("5000");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MutableClock clock;
    private DailyLossBreaker dailyLossBreaker;
    private RiskGate riskGate;
    private ConfigSnapshot config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T10:00:00Z");
        dailyLossBreaker = new DailyLossBreaker(applicationEventPublisher, clock);
        riskGate = new RiskGate(new PositionSizer(), dailyLossBreaker, applicationEventPublisher, clock);
        config = ConfigSnapshot.defaults();
    }

    private CandidateSignal kellyExample() {
        return Fixtures.bondCandidate("KXTEST-1")
                .entryPrice(new BigDecimal("0.06"))
                .modelProbability(new BigDecimal("0.97"))
                .build();
    }

    // ==============================
    // SIZING AND CEILING
    // ==============================

    @Nested
    @DisplayName("Sizing and ceiling")
    class Sizing {

        @Test
        @DisplayName("Kelly size of 40336 is clamped to 12500 by the 15% ceiling")
        void kellySizeClampedToCeiling() {
            TradeDecision decision = riskGate.checkTrade(kellyExample(), BANKROLL, List.of(), config);

            assertThat(decision.isApproved()).isTrue();
            assertThat(decision.getRecommendedSize()).isEqualTo(12500);
        }

        @Test
        @DisplayName("Approved notional never exceeds the position ceiling")
        void approvedNotionalWithinCeiling() {
            CandidateSignal candidate = kellyExample();

            TradeDecision decision = riskGate.checkTrade(candidate, BANKROLL, List.of(), config);

            BigDecimal notional = candidate.getEntryPrice().multiply(BigDecimal.valueOf(decision.getRecommendedSize()));
            assertThat(notional).isLessThanOrEqualTo(riskGate.positionCeiling(BANKROLL, config));
        }

        @Test
        @DisplayName("max_position_pct above 0.20 is capped at the hard 20% ceiling")
        void hardCeilingApplies() {
            ConfigSnapshot loose = config.with(SettingKey.MAX_POSITION_PCT, "0.50");

            assertThat(riskGate.positionCeiling(BANKROLL, loose)).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("Fixed-dollar mode sizes from fixed_trade_amount")
        void fixedDollarMode() {
            ConfigSnapshot fixed = config.with(SettingKey.SIZING_MODE, "fixed_dollar");
            CandidateSignal candidate = Fixtures.bondCandidate("KXTEST-2").build();

            TradeDecision decision = riskGate.checkTrade(candidate, BANKROLL, List.of(), fixed);

            // floor(5 / 0.95) = 5
            assertThat(decision.isApproved()).isTrue();
            assertThat(decision.getRecommendedSize()).isEqualTo(5);
        }

        @Test
        @DisplayName("Negative edge rejects with no positive size")
        void negativeEdgeRejected() {
            CandidateSignal candidate = Fixtures.bondCandidate("KXTEST-3")
                    .entryPrice(new BigDecimal("0.95"))
                    .modelProbability(new BigDecimal("0.90"))
                    .build();

            TradeDecision decision = riskGate.checkTrade(candidate, BANKROLL, List.of(), config);

            assertThat(decision.isApproved()).isFalse();
            assertThat(decision.getReason()).isEqualTo("Sizing produced no positive size");
        }
    }

    // ==============================
    // PORTFOLIO LIMITS
    // ==============================

    @Nested
    @DisplayName("Portfolio limits")
    class PortfolioLimits {

        @Test
        @DisplayName("Low-volume market is rejected for liquidity and publishes TRADE_REJECTED")
        void lowVolumeRejected() {
            CandidateSignal candidate = Fixtures.bondCandidate("KXTHIN")
                    .marketVolume(new BigDecimal("100"))
                    .build();

            TradeDecision decision = riskGate.checkTrade(candidate, BANKROLL, List.of(), config);

            assertThat(decision.isApproved()).isFalse();
            assertThat(decision.getReason()).startsWith("Insufficient liquidity");

            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.TRADE_REJECTED);
            assertThat(captor.getValue().getDetails()).containsEntry("market", "KXTHIN");
        }

        @Test
        @DisplayName("Aggregate exposure above max_total_exposure_pct is rejected")
        void exposureLimitRejected() {
            // 2500 already committed; limit 0.60 * 5000 = 3000; proposed 750
            Position large = Fixtures.position("KXOPEN")
                    .category("Economics")
                    .size(5000)
                    .entryPrice(new BigDecimal("0.50"))
                    .build();

            TradeDecision decision = riskGate.checkTrade(kellyExample(), BANKROLL, List.of(large), config);

            assertThat(decision.isApproved()).isFalse();
            assertThat(decision.getReason()).startsWith("Exposure limit");
        }

        @Test
        @DisplayName("Third position in the same category within the window is rejected")
        void correlationLimitRejected() {
            List<Position> open = List.of(
                    Fixtures.position("KXPOL-1").build(),
                    Fixtures.position("KXPOL-2").build());

            TradeDecision decision = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXPOL-3").build(), BANKROLL, open, config);

            assertThat(decision.isApproved()).isFalse();
            assertThat(decision.getReason()).startsWith("Correlation limit");
        }

        @Test
        @DisplayName("Same-category positions opened before the window do not count")
        void oldCategoryPositionsIgnored() {
            LocalDateTime old = LocalDateTime.of(2026, 3, 1, 0, 0);
            List<Position> open = List.of(
                    Fixtures.position("KXPOL-1").openedAt(old).build(),
                    Fixtures.position("KXPOL-2").openedAt(old).build());

            TradeDecision decision = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXPOL-3").build(), BANKROLL, open, config);

            assertThat(decision.isApproved()).isTrue();
        }
    }

    // ==============================
    // DAILY LOSS LIMIT
    // ==============================

    @Nested
    @DisplayName("Daily loss limit")
    class DailyLoss {

        @Test
        @DisplayName("Loss at -3% latches and rejects every later candidate that day")
        void breachLatchesForTheDay() {
            dailyLossBreaker.recordRealizedPnl(new BigDecimal("-150"));

            TradeDecision first = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXA").build(), BANKROLL, List.of(), config);
            TradeDecision second = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXB").build(), BANKROLL, List.of(), config);

            assertThat(first.getReason()).isEqualTo(RiskGate.REASON_DAILY_LOSS);
            assertThat(second.getReason()).isEqualTo(RiskGate.REASON_DAILY_LOSS);
            assertThat(dailyLossBreaker.isLatched()).isTrue();
        }

        @Test
        @DisplayName("Latch stays set after a later profit the same day")
        void latchSurvivesProfit() {
            dailyLossBreaker.recordRealizedPnl(new BigDecimal("-200"));
            riskGate.checkTrade(Fixtures.bondCandidate("KXA").build(), BANKROLL, List.of(), config);

            dailyLossBreaker.recordRealizedPnl(new BigDecimal("500"));
            TradeDecision decision = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXB").build(), BANKROLL, List.of(), config);

            assertThat(decision.getReason()).isEqualTo(RiskGate.REASON_DAILY_LOSS);
        }

        @Test
        @DisplayName("Next UTC day clears the latch")
        void nextDayClears() {
            dailyLossBreaker.recordRealizedPnl(new BigDecimal("-150"));
            riskGate.checkTrade(Fixtures.bondCandidate("KXA").build(), BANKROLL, List.of(), config);

            clock.advance(Duration.ofDays(1));
            TradeDecision decision = riskGate.checkTrade(
                    Fixtures.bondCandidate("KXB").build(), BANKROLL, List.of(), config);

            assertThat(decision.isApproved()).isTrue();
            verify(applicationEventPublisher, atLeastOnce()).publishEvent(any(RiskEvent.class));
        }
    }
}
