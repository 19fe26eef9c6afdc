package com.marketloop.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.exception.ExchangeUnavailableException;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.execution.ExecutionEngine;
import com.marketloop.execution.FeeCalculator;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.monitor.ExitDecision;
import com.marketloop.monitor.PositionMonitor;
import com.marketloop.support.Fixtures;
import com.marketloop.support.MutableClock;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
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
 * Unit tests for PositionMonitor covering each exit rule in priority order, the
 * adverse-move alert and mark persistence.
 */
@ExtendWith(MockitoExtension.class)
class PositionMonitorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 10, 12, 0);

    @Mock
    private ExchangeGateway exchangeGateway;

    @Mock
    private ExecutionEngine executionEngine;

    @Mock
    private TradeLedgerService tradeLedgerService;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private PositionMonitor positionMonitor;
    private final ConfigSnapshot config = ConfigSnapshot.defaults();

    @BeforeEach
    void setUp() {
        positionMonitor = new PositionMonitor(
                exchangeGateway,
                executionEngine,
                tradeLedgerService,
                new FeeCalculator(),
                applicationEventPublisher,
                MutableClock.at("2026-03-10T12:00:00Z"));
    }

    // ==============================
    // EXIT RULES
    // ==============================

    @Nested
    @DisplayName("Exit rules")
    class ExitRules {

        @Test
        @DisplayName("Resolved market on our side settles at 1.00")
        void resolvedWin() {
            MarketSnapshot market = Fixtures.market("KXA").status("settled").result("yes").build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(Fixtures.position("KXA").build(), market, config, NOW);

            assertThat(exit).hasValueSatisfying(decision -> {
                assertThat(decision.getSettlementPrice()).isEqualByComparingTo("1");
                assertThat(decision.getReason()).isEqualTo("Market resolved yes");
            });
        }

        @Test
        @DisplayName("Resolved market against us settles at 0.00")
        void resolvedLoss() {
            MarketSnapshot market = Fixtures.market("KXA").status("finalized").result("no").build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(Fixtures.position("KXA").build(), market, config, NOW);

            assertThat(exit).hasValueSatisfying(
                    decision -> assertThat(decision.getSettlementPrice()).isEqualByComparingTo("0"));
        }

        @Test
        @DisplayName("Bond inside its 300s pre-expiry window exits at market")
        void preExpiry() {
            MarketSnapshot market = Fixtures.market("KXA").closeTime(NOW.plusSeconds(200)).build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(Fixtures.position("KXA").build(), market, config, NOW);

            assertThat(exit).hasValueSatisfying(decision -> {
                assertThat(decision.getReason()).startsWith("Pre-expiry exit");
                assertThat(decision.getSettlementPrice()).isNull();
            });
        }

        @Test
        @DisplayName("Bond stop-loss fires on an absolute drop of 6 cents")
        void bondStopLoss() {
            Position position = Fixtures.position("KXA").currentPrice(new BigDecimal("0.89")).build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(position, Fixtures.market("KXA").build(), config, NOW);

            assertThat(exit).hasValueSatisfying(decision -> assertThat(decision.getReason()).startsWith("Stop-loss"));
        }

        @Test
        @DisplayName("Market-making stop-loss fires at half the entry value lost")
        void fractionalStopLoss() {
            Position position = Fixtures.position("KXMM")
                    .strategy(StrategyType.MARKET_MAKING)
                    .size(15)
                    .entryPrice(new BigDecimal("0.40"))
                    .currentPrice(new BigDecimal("0.15"))
                    .unrealizedPnl(new BigDecimal("-3.75"))
                    .openedAt(NOW.minusHours(1))
                    .build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(position, Fixtures.market("KXMM").build(), config, NOW);

            assertThat(exit).hasValueSatisfying(decision -> assertThat(decision.getReason()).startsWith("Stop-loss"));
        }

        @Test
        @DisplayName("BTC take-profit fires at a 30% gain")
        void btcTakeProfit() {
            Position position = Fixtures.position("KXBTC")
                    .strategy(StrategyType.BTC_THRESHOLD)
                    .entryPrice(new BigDecimal("0.70"))
                    .currentPrice(new BigDecimal("0.92"))
                    .unrealizedPnl(new BigDecimal("2.20"))
                    .build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(position, Fixtures.market("KXBTC").build(), config, NOW);

            assertThat(exit).hasValueSatisfying(
                    decision -> assertThat(decision.getReason()).startsWith("Take-profit"));
        }

        @Test
        @DisplayName("Market-making position held past 4h is closed")
        void maxHold() {
            Position position = Fixtures.position("KXMM")
                    .strategy(StrategyType.MARKET_MAKING)
                    .entryPrice(new BigDecimal("0.40"))
                    .currentPrice(new BigDecimal("0.40"))
                    .openedAt(NOW.minusHours(5))
                    .build();

            Optional<ExitDecision> exit =
                    positionMonitor.evaluateExit(position, Fixtures.market("KXMM").build(), config, NOW);

            assertThat(exit).hasValueSatisfying(decision -> assertThat(decision.getReason()).isEqualTo("Max hold of 4h exceeded"));
        }

        @Test
        @DisplayName("Healthy bond has no exit")
        void noExit() {
            Position position = Fixtures.position("KXA").currentPrice(new BigDecimal("0.93")).build();

            assertThat(positionMonitor.evaluateExit(position, Fixtures.market("KXA").build(), config, NOW)).isEmpty();
        }
    }

    // ==============================
    // MONITOR PASS
    // ==============================

    @Nested
    @DisplayName("Monitor pass")
    class MonitorPass {

        @Test
        @DisplayName("Resolved position is closed through the execution engine at the settlement price")
        void closesResolved() {
            Position position = Fixtures.position("KXA").build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position));
            when(exchangeGateway.quote("KXA"))
                    .thenReturn(Fixtures.market("KXA").status("settled").result("yes").lastPrice(new BigDecimal("0.99")).build());
            when(executionEngine.closePosition(eq(position), startsWith("Market resolved"), eq(BigDecimal.ONE), eq(config)))
                    .thenReturn(Optional.of(TradeRecord.builder().id("trade-KXA").build()));

            assertThat(positionMonitor.monitorPositions(config)).isEqualTo(1);
            verify(tradeLedgerService, never()).updateMark(any());
        }

        @Test
        @DisplayName("Failed exit order leaves the count at zero")
        void failedExitNotCounted() {
            Position position = Fixtures.position("KXA").build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position));
            when(exchangeGateway.quote("KXA")).thenReturn(Fixtures.market("KXA").lastPrice(new BigDecimal("0.85")).build());
            when(executionEngine.closePosition(eq(position), startsWith("Stop-loss"), isNull(), eq(config)))
                    .thenReturn(Optional.empty());

            assertThat(positionMonitor.monitorPositions(config)).isZero();
        }

        @Test
        @DisplayName("Adverse move beyond the alert threshold publishes an alert and persists the mark")
        void adverseMoveAlert() {
            Position position = Fixtures.position("KXMM")
                    .strategy(StrategyType.MARKET_MAKING)
                    .side(Side.YES)
                    .entryPrice(new BigDecimal("0.50"))
                    .currentPrice(new BigDecimal("0.50"))
                    .openedAt(NOW.minusHours(1))
                    .build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position));
            when(exchangeGateway.quote("KXMM")).thenReturn(Fixtures.market("KXMM").lastPrice(new BigDecimal("0.38")).build());

            assertThat(positionMonitor.monitorPositions(config)).isZero();

            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.ADVERSE_MOVE_ALERT);
            verify(tradeLedgerService).updateMark(position);
            assertThat(position.getCurrentPrice()).isEqualByComparingTo("0.38");
            assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("-1.20");
        }

        @Test
        @DisplayName("Position whose exit order already went out is finalized without a new quote")
        void exitInFlightFinalized() {
            Position position = Fixtures.position("KXA")
                    .exitOrderId("exit-client-1")
                    .exitPrice(new BigDecimal("0.70"))
                    .exitReason("Stop-loss: price fell 0.25 (limit 0.06)")
                    .build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position));
            when(executionEngine.closePosition(position, "Stop-loss: price fell 0.25 (limit 0.06)", null, config))
                    .thenReturn(Optional.of(TradeRecord.builder().id("trade-KXA").build()));

            assertThat(positionMonitor.monitorPositions(config)).isEqualTo(1);
            verify(exchangeGateway, never()).quote(any());
        }

        @Test
        @DisplayName("Stale entries are reconciled before exits and positions are re-read")
        void staleEntriesReconciledFirst() {
            Position position = Fixtures.position("KXA").build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position), List.of());
            when(executionEngine.reconcileStaleEntries(List.of(position), config, NOW)).thenReturn(1);

            assertThat(positionMonitor.monitorPositions(config)).isZero();
            verify(exchangeGateway, never()).quote(any());
        }

        @Test
        @DisplayName("Quote failure skips the position for this pass")
        void quoteFailureSkips() {
            Position position = Fixtures.position("KXA").build();
            when(tradeLedgerService.getOpenPositions()).thenReturn(List.of(position));
            when(exchangeGateway.quote("KXA")).thenThrow(new ExchangeUnavailableException("timeout", 503));

            assertThat(positionMonitor.monitorPositions(config)).isZero();
            verify(executionEngine, never()).closePosition(any(), any(), any(), any());
            verify(tradeLedgerService, never()).updateMark(any());
        }
    }
}
