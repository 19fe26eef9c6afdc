package com.marketloop.monitor;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.Position;
import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.event.RiskLevel;
import com.marketloop.exception.ExchangeException;
import com.marketloop.exception.ResourceNotFoundException;
import com.marketloop.execution.ExecutionEngine;
import com.marketloop.execution.FeeCalculator;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.settings.SettingKey;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Re-prices every open position and closes the ones whose exit rule fires.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>market resolved: settle at 1.00 if the result is our side, else 0.00</li>
 *   <li>time to close within the strategy's pre-expiry window</li>
 *   <li>stop-loss: absolute price drop for bonds, fraction of entry value otherwise</li>
 *   <li>take-profit for BTC threshold positions</li>
 *   <li>maximum hold time for strategies that have one</li>
 * </ol>
 * A price move against us beyond {@code alert_threshold} is logged at ERROR but does not exit.
 * A position whose exit order already went out is finalized without a new quote. Entry
 * orders still resting past {@code entry_fill_timeout_sec} are cancelled first.
 * Positions with no exit get their refreshed mark persisted.
 */
@Service
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final ExchangeGateway exchangeGateway;
    private final ExecutionEngine executionEngine;
    private final TradeLedgerService tradeLedgerService;
    private final FeeCalculator feeCalculator;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PositionMonitor(
            ExchangeGateway exchangeGateway,
            ExecutionEngine executionEngine,
            TradeLedgerService tradeLedgerService,
            FeeCalculator feeCalculator,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.executionEngine = executionEngine;
        this.tradeLedgerService = tradeLedgerService;
        this.feeCalculator = feeCalculator;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /** @return the number of positions closed this pass */
    public int monitorPositions(ConfigSnapshot config) {
        List<Position> positions = tradeLedgerService.getOpenPositions();
        if (positions.isEmpty()) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (executionEngine.reconcileStaleEntries(positions, config, now) > 0) {
            positions = tradeLedgerService.getOpenPositions();
        }
        int closed = 0;
        for (Position position : positions) {
            if (position.isExiting()) {
                if (close(position, ExitDecision.exit(position.getExitReason()), config)) {
                    closed++;
                }
                continue;
            }

            MarketSnapshot market;
            try {
                market = exchangeGateway.quote(position.getMarketId());
            } catch (ExchangeException e) {
                log.warn("Quote failed for market={}, skipping this cycle: {}", position.getMarketId(), e.getMessage());
                continue;
            }

            market.markPrice(position.getSide()).ifPresent(price -> {
                position.setCurrentPrice(price);
                position.setUnrealizedPnl(
                        feeCalculator.unrealizedPnl(position.getEntryPrice(), price, position.getSize()));
            });

            Optional<ExitDecision> exit = evaluateExit(position, market, config, now);
            if (exit.isPresent()) {
                if (close(position, exit.get(), config)) {
                    closed++;
                }
                continue;
            }

            checkAdverseMove(position, config);
            tradeLedgerService.updateMark(position);
        }
        if (closed > 0) {
            log.info("Position monitor closed {} of {} positions", closed, positions.size());
        }
        return closed;
    }

    /** Applies the exit rules to one already re-priced position. */
    public Optional<ExitDecision> evaluateExit(
            Position position, MarketSnapshot market, ConfigSnapshot config, LocalDateTime now) {
        if (market.isResolved()) {
            Optional<Side> result = market.resultSide();
            if (result.isPresent()) {
                BigDecimal settlement = result.get() == position.getSide() ? BigDecimal.ONE : BigDecimal.ZERO;
                return Optional.of(ExitDecision.settle("Market resolved " + result.get().wireValue(), settlement));
            }
        }

        StrategyType strategy = position.getStrategy();
        LocalDateTime closeTime = market.getCloseTime() != null ? market.getCloseTime() : position.getExpiresAt();
        if (closeTime != null) {
            long secondsLeft = Duration.between(now, closeTime).getSeconds();
            int window = config.getInt(strategy.getPreExpiryKey());
            if (secondsLeft <= window) {
                return Optional.of(ExitDecision.exit(
                        String.format("Pre-expiry exit: %ds to close (window %ds)", secondsLeft, window)));
            }
        }

        BigDecimal entry = position.getEntryPrice();
        BigDecimal current = position.getCurrentPrice();
        if (current != null) {
            if (strategy == StrategyType.BOND) {
                BigDecimal drop = entry.subtract(current);
                BigDecimal stop = config.getDecimal(SettingKey.BOND_STOP_LOSS_CENTS);
                if (drop.compareTo(stop) >= 0) {
                    return Optional.of(ExitDecision.exit(
                            String.format("Stop-loss: price fell %s (limit %s)", drop, stop)));
                }
            } else {
                BigDecimal limit = config.getDecimal(SettingKey.STOP_LOSS_THRESHOLD)
                        .multiply(position.getEntryValue())
                        .negate();
                BigDecimal unrealized = position.getUnrealizedPnl() != null ? position.getUnrealizedPnl() : BigDecimal.ZERO;
                if (unrealized.compareTo(limit) <= 0) {
                    return Optional.of(ExitDecision.exit(
                            String.format("Stop-loss: unrealized %s (limit %s)", unrealized, limit)));
                }
            }

            if (strategy == StrategyType.BTC_THRESHOLD && entry.signum() > 0) {
                BigDecimal gain = current.subtract(entry).divide(entry, 6, RoundingMode.HALF_UP);
                BigDecimal target = config.getDecimal(SettingKey.BTC_TAKE_PROFIT_PCT);
                if (gain.compareTo(target) >= 0) {
                    return Optional.of(ExitDecision.exit(
                            String.format("Take-profit: gain %s (target %s)", gain, target)));
                }
            }
        }

        Optional<SettingKey> maxHoldKey = strategy.getMaxHoldKey();
        if (maxHoldKey.isPresent() && position.getOpenedAt() != null) {
            int maxHours = config.getInt(maxHoldKey.get());
            if (!position.getOpenedAt().plusHours(maxHours).isAfter(now)) {
                return Optional.of(ExitDecision.exit(String.format("Max hold of %dh exceeded", maxHours)));
            }
        }
        return Optional.empty();
    }

    private boolean close(Position position, ExitDecision exit, ConfigSnapshot config) {
        log.info("Exit triggered: market={} side={} reason={}", position.getMarketId(), position.getSide(),
                exit.getReason());
        try {
            return executionEngine
                    .closePosition(position, exit.getReason(), exit.getSettlementPrice(), config)
                    .isPresent();
        } catch (ResourceNotFoundException e) {
            log.error("Position for market={} has no trade row: {}", position.getMarketId(), e.getMessage());
            return false;
        }
    }

    private void checkAdverseMove(Position position, ConfigSnapshot config) {
        if (position.getCurrentPrice() == null) {
            return;
        }
        BigDecimal move = position.getEntryPrice().subtract(position.getCurrentPrice());
        BigDecimal threshold = config.getDecimal(SettingKey.ALERT_THRESHOLD);
        if (move.compareTo(threshold) > 0) {
            log.error(
                    "Adverse move alert: market={} side={} entry={} current={} move={} threshold={}",
                    position.getMarketId(),
                    position.getSide(),
                    position.getEntryPrice(),
                    position.getCurrentPrice(),
                    move,
                    threshold);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.ADVERSE_MOVE_ALERT,
                    RiskLevel.WARNING,
                    "Adverse move on " + position.getMarketId(),
                    Map.of("market", position.getMarketId(), "move", move)));
        }
    }
}
