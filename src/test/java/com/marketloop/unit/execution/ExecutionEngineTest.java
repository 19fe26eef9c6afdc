package com.marketloop.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketloop.config.LoopProperties;
import com.marketloop.domain.enums.OrderAction;
import com.marketloop.domain.enums.OrderStatus;
import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.OrderAck;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeDecision;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.event.TradeClosedEvent;
import com.marketloop.event.TradeOpenedEvent;
import com.marketloop.exception.ExchangeException;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.exchange.OrderRequest;
import com.marketloop.execution.ExecutionEngine;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.observability.LoopMetrics;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.support.Fixtures;
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
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Unit tests for ExecutionEngine: single entry per market, paper mode, order failure,
 * compensation when the ledger write fails, closing and stale entry reconciliation.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionEngineTest {

    @Mock
    private ExchangeGateway exchangeGateway;

    @Mock
    private TradeLedgerService tradeLedgerService;

    @Mock
    private DailyLossBreaker dailyLossBreaker;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @Mock
    private LoopMetrics loopMetrics;

    private LoopProperties loopProperties;
    private ExecutionEngine executionEngine;

    private final CandidateSignal signal = Fixtures.bondCandidate("KXA").build();
    private final TradeDecision approved = TradeDecision.approved(12, "ok", new BigDecimal("0.1"));

    @BeforeEach
    void setUp() {
        loopProperties = new LoopProperties();
        loopProperties.setPaperTrade(false);
        executionEngine = new ExecutionEngine(
                exchangeGateway,
                tradeLedgerService,
                dailyLossBreaker,
                applicationEventPublisher,
                loopMetrics,
                loopProperties);
    }

    private TradeRecord openTrade(String orderId) {
        return TradeRecord.builder()
                .id("trade-KXA")
                .marketId("KXA")
                .side(Side.YES)
                .size(12)
                .entryPrice(new BigDecimal("0.95"))
                .status(TradeStatus.OPEN)
                .orderId(orderId)
                .build();
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("Approved decision places one BUY limit in cents and records the trade")
        void placesAndRecords() {
            when(tradeLedgerService.hasPosition("KXA")).thenReturn(false);
            when(exchangeGateway.placeOrder(any())).thenReturn(new OrderAck("ord-1", OrderStatus.RESTING));
            when(tradeLedgerService.openTrade(signal, 12, "ord-1")).thenReturn(openTrade("ord-1"));

            assertThat(executionEngine.execute(approved, signal)).isTrue();

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            verify(exchangeGateway).placeOrder(captor.capture());
            assertThat(captor.getValue().getAction()).isEqualTo(OrderAction.BUY);
            assertThat(captor.getValue().getPriceCents()).isEqualTo(95);
            assertThat(captor.getValue().getCount()).isEqualTo(12);
            verify(applicationEventPublisher).publishEvent(any(TradeOpenedEvent.class));
        }

        @Test
        @DisplayName("Market with an open position is never entered again")
        void atMostOnePositionPerMarket() {
            when(tradeLedgerService.hasPosition("KXA")).thenReturn(true);

            assertThat(executionEngine.execute(approved, signal)).isFalse();
            verify(exchangeGateway, never()).placeOrder(any());
            verify(tradeLedgerService, never()).openTrade(any(), anyInt(), anyString());
        }

        @Test
        @DisplayName("Rejected decision does nothing")
        void rejectedDecision() {
            assertThat(executionEngine.execute(TradeDecision.rejected("no"), signal)).isFalse();
            verify(exchangeGateway, never()).placeOrder(any());
        }

        @Test
        @DisplayName("Exchange failure records an order failure and opens nothing")
        void exchangeFailure() {
            when(tradeLedgerService.hasPosition("KXA")).thenReturn(false);
            when(exchangeGateway.placeOrder(any())).thenThrow(new ExchangeException("rejected", 400));

            assertThat(executionEngine.execute(approved, signal)).isFalse();
            verify(loopMetrics).recordOrderFailure();
            verify(tradeLedgerService, never()).openTrade(any(), anyInt(), anyString());
        }

        @Test
        @DisplayName("Ledger failure after a fill cancels the order just placed")
        void ledgerFailureCompensates() {
            when(tradeLedgerService.hasPosition("KXA")).thenReturn(false);
            when(exchangeGateway.placeOrder(any())).thenReturn(new OrderAck("ord-9", OrderStatus.EXECUTED));
            when(tradeLedgerService.openTrade(signal, 12, "ord-9"))
                    .thenThrow(new DataIntegrityViolationException("duplicate market"));

            assertThat(executionEngine.execute(approved, signal)).isFalse();
            verify(exchangeGateway).cancelOrder("ord-9");
            verify(applicationEventPublisher, never()).publishEvent(any(TradeOpenedEvent.class));
        }

        @Test
        @DisplayName("Paper mode records a paper- order id without calling the exchange")
        void paperMode() {
            loopProperties.setPaperTrade(true);
            when(tradeLedgerService.hasPosition("KXA")).thenReturn(false);
            when(tradeLedgerService.openTrade(eq(signal), eq(12), startsWith("paper-"))).thenReturn(openTrade("paper-1"));

            assertThat(executionEngine.execute(approved, signal)).isTrue();
            verify(exchangeGateway, never()).placeOrder(any());
        }
    }

    @Nested
    @DisplayName("Close")
    class Close {

        private final Position position = Fixtures.position("KXA").currentPrice(new BigDecimal("0.80")).build();

        private TradeRecord closed(String net) {
            return TradeRecord.builder()
                    .id("trade-KXA")
                    .marketId("KXA")
                    .status(TradeStatus.CLOSED)
                    .netPnl(new BigDecimal(net))
                    .build();
        }

        @Test
        @DisplayName("Settlement close sends no exit order and books PnL into the breaker")
        void settlementClose() {
            when(exchangeGateway.openOrders()).thenReturn(List.of());
            when(tradeLedgerService.closeTrade(position, BigDecimal.ONE, "Market resolved", new BigDecimal("0.07")))
                    .thenReturn(closed("-0.90"));

            Optional<TradeRecord> result = executionEngine.closePosition(
                    position, "Market resolved", BigDecimal.ONE, ConfigSnapshot.defaults());

            assertThat(result).isPresent();
            verify(exchangeGateway, never()).placeOrder(any());
            verify(dailyLossBreaker).recordRealizedPnl(new BigDecimal("-0.90"));
            verify(applicationEventPublisher).publishEvent(any(TradeClosedEvent.class));
        }

        @Test
        @DisplayName("Market exit cancels resting orders, records the exit, sells, then finalizes")
        void marketExit() {
            ExchangeOrder resting = ExchangeOrder.builder()
                    .orderId("rest-1")
                    .marketId("KXA")
                    .side(Side.YES)
                    .action(OrderAction.BUY)
                    .status(OrderStatus.RESTING)
                    .priceCents(90)
                    .remainingCount(5)
                    .build();
            when(exchangeGateway.openOrders()).thenReturn(List.of(resting));
            when(exchangeGateway.placeOrder(any())).thenReturn(new OrderAck("exit-1", OrderStatus.EXECUTED));
            when(tradeLedgerService.closeTrade(eq(position), eq(new BigDecimal("0.80")), eq("Stop-loss"), any()))
                    .thenReturn(closed("-1.80"));

            executionEngine.closePosition(position, "Stop-loss", null, ConfigSnapshot.defaults());

            ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
            InOrder inOrder = inOrder(exchangeGateway, tradeLedgerService);
            inOrder.verify(exchangeGateway).cancelOrder("rest-1");
            inOrder.verify(tradeLedgerService)
                    .markExiting(eq("KXA"), anyString(), eq(new BigDecimal("0.80")), eq("Stop-loss"));
            inOrder.verify(exchangeGateway).placeOrder(captor.capture());
            inOrder.verify(tradeLedgerService).closeTrade(eq(position), eq(new BigDecimal("0.80")), eq("Stop-loss"), any());
            assertThat(captor.getValue().getAction()).isEqualTo(OrderAction.SELL);
            assertThat(captor.getValue().getPriceCents()).isEqualTo(80);
        }

        @Test
        @DisplayName("Ledger failure after the exit went out never sends a second SELL")
        void ledgerFailureAfterExitSellsOnce() {
            when(exchangeGateway.openOrders()).thenReturn(List.of());
            when(exchangeGateway.placeOrder(any())).thenReturn(new OrderAck("exit-1", OrderStatus.EXECUTED));
            when(tradeLedgerService.closeTrade(any(), any(), any(), any()))
                    .thenThrow(new DataAccessResourceFailureException("db locked"))
                    .thenReturn(closed("-1.80"));

            assertThatThrownBy(() ->
                            executionEngine.closePosition(position, "Stop-loss", null, ConfigSnapshot.defaults()))
                    .isInstanceOf(DataAccessResourceFailureException.class);

            ArgumentCaptor<String> clientOrderId = ArgumentCaptor.forClass(String.class);
            verify(tradeLedgerService).markExiting(eq("KXA"), clientOrderId.capture(), any(), eq("Stop-loss"));

            // Next monitor pass reloads the position with the recorded exit
            Position reloaded = Fixtures.position("KXA")
                    .currentPrice(new BigDecimal("0.78"))
                    .exitOrderId(clientOrderId.getValue())
                    .exitPrice(new BigDecimal("0.80"))
                    .exitReason("Stop-loss")
                    .build();
            Optional<TradeRecord> result =
                    executionEngine.closePosition(reloaded, "Stop-loss", null, ConfigSnapshot.defaults());

            assertThat(result).isPresent();
            verify(exchangeGateway, times(1)).placeOrder(any());
            verify(tradeLedgerService).closeTrade(eq(reloaded), eq(new BigDecimal("0.80")), eq("Stop-loss"), any());
            verify(dailyLossBreaker).recordRealizedPnl(new BigDecimal("-1.80"));
        }

        @Test
        @DisplayName("Failed exit order keeps the position open")
        void failedExitKeepsPosition() {
            when(exchangeGateway.openOrders()).thenReturn(List.of());
            when(exchangeGateway.placeOrder(any())).thenThrow(new ExchangeException("halted", 409));

            Optional<TradeRecord> result =
                    executionEngine.closePosition(position, "Stop-loss", null, ConfigSnapshot.defaults());

            assertThat(result).isEmpty();
            verify(tradeLedgerService).clearExiting("KXA");
            verify(tradeLedgerService, never()).closeTrade(any(), any(), any(), any());
            verify(dailyLossBreaker, never()).recordRealizedPnl(any());
        }
    }

    // ==============================
    // STALE ENTRIES
    // ==============================

    @Nested
    @DisplayName("Stale entry reconciliation")
    class StaleEntries {

        private final LocalDateTime now = LocalDateTime.of(2026, 3, 10, 12, 0);

        private ExchangeOrder restingEntry(String orderId, int remaining) {
            return ExchangeOrder.builder()
                    .orderId(orderId)
                    .marketId("KXA")
                    .side(Side.YES)
                    .action(OrderAction.BUY)
                    .status(OrderStatus.RESTING)
                    .priceCents(95)
                    .remainingCount(remaining)
                    .build();
        }

        private Position entry(LocalDateTime openedAt) {
            return Fixtures.position("KXA").entryOrderId("ord-1").openedAt(openedAt).build();
        }

        @Test
        @DisplayName("Unfilled entry past the timeout is cancelled on the exchange and in the ledger")
        void unfilledEntryCancelled() {
            when(exchangeGateway.openOrders()).thenReturn(List.of(restingEntry("ord-1", 10)));

            int reconciled = executionEngine.reconcileStaleEntries(
                    List.of(entry(now.minusMinutes(10))), ConfigSnapshot.defaults(), now);

            assertThat(reconciled).isEqualTo(1);
            InOrder inOrder = inOrder(exchangeGateway, tradeLedgerService);
            inOrder.verify(exchangeGateway).cancelOrder("ord-1");
            inOrder.verify(tradeLedgerService).cancelTrade("trade-KXA", "Entry order unfilled after 300s");
        }

        @Test
        @DisplayName("Partially filled entry keeps the contracts bought")
        void partialFillResized() {
            when(exchangeGateway.openOrders()).thenReturn(List.of(restingEntry("ord-1", 3)));

            executionEngine.reconcileStaleEntries(List.of(entry(now.minusMinutes(10))), ConfigSnapshot.defaults(), now);

            verify(exchangeGateway).cancelOrder("ord-1");
            verify(tradeLedgerService).resizeEntry("trade-KXA", 7);
            verify(tradeLedgerService, never()).cancelTrade(anyString(), anyString());
        }

        @Test
        @DisplayName("Entry younger than the timeout is left resting")
        void freshEntryKept() {
            when(exchangeGateway.openOrders()).thenReturn(List.of(restingEntry("ord-1", 10)));

            int reconciled = executionEngine.reconcileStaleEntries(
                    List.of(entry(now.minusMinutes(2))), ConfigSnapshot.defaults(), now);

            assertThat(reconciled).isZero();
            verify(exchangeGateway, never()).cancelOrder(anyString());
        }

        @Test
        @DisplayName("Failed cancel leaves the ledger untouched")
        void cancelFailureKeepsLedger() {
            when(exchangeGateway.openOrders()).thenReturn(List.of(restingEntry("ord-1", 10)));
            doThrow(new ExchangeException("not found", 404)).when(exchangeGateway).cancelOrder("ord-1");

            int reconciled = executionEngine.reconcileStaleEntries(
                    List.of(entry(now.minusMinutes(10))), ConfigSnapshot.defaults(), now);

            assertThat(reconciled).isZero();
            verify(tradeLedgerService, never()).cancelTrade(anyString(), anyString());
        }

        @Test
        @DisplayName("Paper mode has no exchange orders to reconcile")
        void paperModeSkips() {
            loopProperties.setPaperTrade(true);

            assertThat(executionEngine.reconcileStaleEntries(
                            List.of(entry(now.minusHours(1))), ConfigSnapshot.defaults(), now))
                    .isZero();
            verify(exchangeGateway, never()).openOrders();
        }
    }
}
