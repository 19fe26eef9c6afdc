package com.marketloop.execution;

import com.marketloop.config.LoopProperties;
import com.marketloop.domain.enums.OrderAction;
import com.marketloop.domain.enums.OrderStatus;
import com.marketloop.domain.enums.OrderType;
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
import com.marketloop.observability.LoopMetrics;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.settings.SettingKey;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * The only component that submits orders and changes trade or position state.
 *
 * <p>Entry pipeline:
 * <ol>
 *   <li>Reject unapproved decisions and markets that already hold a position</li>
 *   <li>Submit one limit order in whole cents (never retried)</li>
 *   <li>On an accepted ack, persist the trade and position in one transaction</li>
 *   <li>If that transaction fails, cancel the order just placed</li>
 * </ol>
 *
 * <p>In paper mode orders get a synthetic {@code paper-} id and the exchange order
 * endpoints are never called.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String PAPER_ORDER_PREFIX = "paper-";

    private final ExchangeGateway exchangeGateway;
    private final TradeLedgerService tradeLedgerService;
    private final DailyLossBreaker dailyLossBreaker;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final LoopMetrics loopMetrics;
    private final LoopProperties loopProperties;

    public ExecutionEngine(
            ExchangeGateway exchangeGateway,
            TradeLedgerService tradeLedgerService,
            DailyLossBreaker dailyLossBreaker,
            ApplicationEventPublisher applicationEventPublisher,
            LoopMetrics loopMetrics,
            LoopProperties loopProperties) {
        this.exchangeGateway = exchangeGateway;
        this.tradeLedgerService = tradeLedgerService;
        this.dailyLossBreaker = dailyLossBreaker;
        this.applicationEventPublisher = applicationEventPublisher;
        this.loopMetrics = loopMetrics;
        this.loopProperties = loopProperties;
    }

    /**
     * Places and records one entry.
     *
     * @return true when a position was opened
     */
    public boolean execute(TradeDecision decision, CandidateSignal signal) {
        if (!decision.isApproved() || decision.getRecommendedSize() <= 0) {
            log.debug("Not executing unapproved decision for {}: {}", signal.getMarketId(), decision.getReason());
            return false;
        }
        if (tradeLedgerService.hasPosition(signal.getMarketId())) {
            log.info("Skipping entry: market={} already has an open position", signal.getMarketId());
            return false;
        }

        int size = decision.getRecommendedSize();
        OrderRequest request = OrderRequest.builder()
                .marketId(signal.getMarketId())
                .side(signal.getSide())
                .action(OrderAction.BUY)
                .count(size)
                .priceCents(FeeCalculator.toCents(signal.getEntryPrice()))
                .type(OrderType.LIMIT)
                .clientOrderId(UUID.randomUUID().toString())
                .build();

        Optional<String> orderId = submit(request);
        if (orderId.isEmpty()) {
            loopMetrics.recordOrderFailure();
            return false;
        }

        TradeRecord trade;
        try {
            trade = tradeLedgerService.openTrade(signal, size, orderId.get());
        } catch (DataAccessException e) {
            log.error(
                    "CRITICAL: order {} placed for market={} but the trade could not be recorded, cancelling",
                    orderId.get(),
                    signal.getMarketId(),
                    e);
            compensate(orderId.get());
            return false;
        }

        applicationEventPublisher.publishEvent(new TradeOpenedEvent(this, trade));
        return true;
    }

    /**
     * Closes a position. Resting orders for the market are cancelled first; unless the
     * market has settled, an exit order is sent at the current price.
     *
     * <p>The exit is recorded on the position before the SELL is sent. A position that
     * already carries an exit is only finalized, never sold a second time.
     *
     * @param settlementPrice the settlement price for resolved markets, null for market exits
     * @return the finalized trade, or empty when the exit order failed and the position stays open
     */
    public Optional<TradeRecord> closePosition(
            Position position, String reason, BigDecimal settlementPrice, ConfigSnapshot config) {
        if (position.isExiting()) {
            log.warn("Exit {} already sent for market={}, finalizing the ledger only", position.getExitOrderId(),
                    position.getMarketId());
            return Optional.of(finalizeClose(position, position.getExitPrice(), position.getExitReason(), config));
        }

        cancelRestingOrders(position.getMarketId());

        BigDecimal exitPrice = settlementPrice != null ? settlementPrice : markOrEntry(position);
        if (settlementPrice == null) {
            String clientOrderId = UUID.randomUUID().toString();
            tradeLedgerService.markExiting(position.getMarketId(), clientOrderId, exitPrice, reason);

            OrderRequest exit = OrderRequest.builder()
                    .marketId(position.getMarketId())
                    .side(position.getSide())
                    .action(OrderAction.SELL)
                    .count(position.getSize())
                    .priceCents(FeeCalculator.toCents(exitPrice))
                    .type(OrderType.LIMIT)
                    .clientOrderId(clientOrderId)
                    .build();
            if (submit(exit).isEmpty()) {
                loopMetrics.recordOrderFailure();
                releaseExit(position.getMarketId());
                log.warn("Exit order failed for market={}, position kept open for next cycle", position.getMarketId());
                return Optional.empty();
            }
        }

        return Optional.of(finalizeClose(position, exitPrice, reason, config));
    }

    /**
     * Cancels entry orders still resting past {@code entry_fill_timeout_sec}. An entry with
     * no fill is cancelled in the ledger; a partial fill keeps the contracts bought.
     *
     * @return the number of positions removed or resized
     */
    public int reconcileStaleEntries(List<Position> positions, ConfigSnapshot config, LocalDateTime now) {
        if (loopProperties.isPaperTrade() || positions.isEmpty()) {
            return 0;
        }
        List<ExchangeOrder> resting;
        try {
            resting = exchangeGateway.openOrders();
        } catch (ExchangeException e) {
            log.warn("Could not list resting orders for entry reconciliation: {}", e.getMessage());
            return 0;
        }
        Map<String, ExchangeOrder> restingById = new HashMap<>();
        for (ExchangeOrder order : resting) {
            if (order.getAction() == OrderAction.BUY
                    && (order.getStatus() == OrderStatus.RESTING || order.getStatus() == OrderStatus.PENDING)) {
                restingById.put(order.getOrderId(), order);
            }
        }

        int timeoutSeconds = config.getInt(SettingKey.ENTRY_FILL_TIMEOUT_SEC);
        int reconciled = 0;
        for (Position position : positions) {
            ExchangeOrder entry = position.getEntryOrderId() != null ? restingById.get(position.getEntryOrderId()) : null;
            if (entry == null || position.isExiting() || position.getOpenedAt() == null) {
                continue;
            }
            if (position.getOpenedAt().plusSeconds(timeoutSeconds).isAfter(now)) {
                continue;
            }
            try {
                exchangeGateway.cancelOrder(entry.getOrderId());
            } catch (ExchangeException e) {
                log.warn("Could not cancel stale entry {} for market={}: {}", entry.getOrderId(),
                        position.getMarketId(), e.getMessage());
                continue;
            }
            int filled = position.getSize() - entry.getRemainingCount();
            if (filled <= 0) {
                tradeLedgerService.cancelTrade(position.getTradeId(),
                        String.format("Entry order unfilled after %ds", timeoutSeconds));
            } else {
                tradeLedgerService.resizeEntry(position.getTradeId(), filled);
            }
            reconciled++;
        }
        if (reconciled > 0) {
            log.info("Reconciled {} stale entry orders", reconciled);
        }
        return reconciled;
    }

    /** Cancels every resting order the exchange reports for {@code marketId}. */
    public int cancelRestingOrders(String marketId) {
        if (loopProperties.isPaperTrade()) {
            return 0;
        }
        List<ExchangeOrder> resting;
        try {
            resting = exchangeGateway.openOrders();
        } catch (ExchangeException e) {
            log.warn("Could not list resting orders for market={}: {}", marketId, e.getMessage());
            return 0;
        }
        int cancelled = 0;
        for (ExchangeOrder order : resting) {
            if (!marketId.equals(order.getMarketId())) {
                continue;
            }
            try {
                exchangeGateway.cancelOrder(order.getOrderId());
                cancelled++;
            } catch (ExchangeException e) {
                log.warn("Failed to cancel resting order {} for market={}: {}", order.getOrderId(), marketId,
                        e.getMessage());
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} resting orders for market={}", cancelled, marketId);
        }
        return cancelled;
    }

    private Optional<String> submit(OrderRequest request) {
        if (loopProperties.isPaperTrade()) {
            String paperId = PAPER_ORDER_PREFIX + UUID.randomUUID();
            log.info(
                    "[PAPER] {} {} x{} {} @ {}c id={}",
                    request.getAction(),
                    request.getSide(),
                    request.getCount(),
                    request.getMarketId(),
                    request.getPriceCents(),
                    paperId);
            return Optional.of(paperId);
        }
        try {
            OrderAck ack = exchangeGateway.placeOrder(request);
            if (!ack.isAccepted()) {
                log.warn("Order not accepted: market={} side={} action={} status={}",
                        request.getMarketId(), request.getSide(), request.getAction(), ack.getStatus());
                return Optional.empty();
            }
            return Optional.of(ack.getOrderId());
        } catch (ExchangeException e) {
            log.warn("Order submission failed: market={} side={} action={} error={}",
                    request.getMarketId(), request.getSide(), request.getAction(), e.getMessage());
            return Optional.empty();
        }
    }

    private TradeRecord finalizeClose(Position position, BigDecimal exitPrice, String reason, ConfigSnapshot config) {
        TradeRecord closed = tradeLedgerService.closeTrade(
                position, exitPrice, reason, config.getDecimal(SettingKey.FEE_PER_CONTRACT));
        dailyLossBreaker.recordRealizedPnl(closed.getNetPnl());
        applicationEventPublisher.publishEvent(new TradeClosedEvent(this, closed));
        return closed;
    }

    private void releaseExit(String marketId) {
        try {
            tradeLedgerService.clearExiting(marketId);
        } catch (DataAccessException e) {
            log.error("CRITICAL: exit for market={} was refused but the position is still marked exiting, "
                    + "manual check needed", marketId, e);
            throw e;
        }
    }

    private void compensate(String orderId) {
        if (orderId.startsWith(PAPER_ORDER_PREFIX)) {
            return;
        }
        try {
            exchangeGateway.cancelOrder(orderId);
            log.warn("Compensating cancel sent for order {}", orderId);
        } catch (ExchangeException e) {
            log.error("CRITICAL: compensating cancel failed for order {}, manual intervention needed", orderId, e);
        }
    }

    private static BigDecimal markOrEntry(Position position) {
        return position.getCurrentPrice() != null ? position.getCurrentPrice() : position.getEntryPrice();
    }
}
