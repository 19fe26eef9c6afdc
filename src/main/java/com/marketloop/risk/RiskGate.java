package com.marketloop.risk;

import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeDecision;
import com.marketloop.event.RiskEvent;
import com.marketloop.event.RiskEventType;
import com.marketloop.event.RiskLevel;
import com.marketloop.settings.SettingKey;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * The single checkpoint every candidate passes before capital is committed.
 *
 * <p>Sizing is computed first; the checks then run in order and stop at the first
 * rejection:
 * <ol>
 *   <li>daily loss latch already set</li>
 *   <li>liquidity floor ({@code min_market_volume})</li>
 *   <li>single-position ceiling, {@code min(max_position_pct, 0.20) * bankroll}: clamps, never rejects</li>
 *   <li>aggregate exposure ({@code max_total_exposure_pct})</li>
 *   <li>category correlation ({@code max_category_positions} within {@code category_window_hours})</li>
 *   <li>daily loss breaker ({@code daily_loss_limit_pct}), which latches</li>
 *   <li>a positive final size</li>
 * </ol>
 *
 * <p>Side effects are limited to logging, a {@link RiskEvent} per rejection and the
 * breaker latch.
 */
@Component
public class RiskGate {

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    public static final String REASON_DAILY_LOSS = "Daily loss limit";
    static final BigDecimal HARD_POSITION_CEILING = new BigDecimal("0.20");

    private final PositionSizer positionSizer;
    private final DailyLossBreaker dailyLossBreaker;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public RiskGate(
            PositionSizer positionSizer,
            DailyLossBreaker dailyLossBreaker,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.positionSizer = positionSizer;
        this.dailyLossBreaker = dailyLossBreaker;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public TradeDecision checkTrade(
            CandidateSignal candidate, BigDecimal bankroll, Collection<Position> openPositions, ConfigSnapshot config) {
        if (dailyLossBreaker.isLatched()) {
            return reject(candidate, REASON_DAILY_LOSS);
        }

        SizingResult sizing = positionSizer.size(candidate, bankroll, config);
        int contracts = sizing.getContracts();
        BigDecimal price = candidate.getEntryPrice();

        BigDecimal minVolume = config.getDecimal(SettingKey.MIN_MARKET_VOLUME);
        BigDecimal volume = candidate.getMarketVolume() != null ? candidate.getMarketVolume() : BigDecimal.ZERO;
        if (volume.compareTo(minVolume) < 0) {
            return reject(candidate, String.format("Insufficient liquidity: volume %s < %s", volume, minVolume));
        }

        BigDecimal ceiling = positionCeiling(bankroll, config);
        if (contracts > 0 && notional(contracts, price).compareTo(ceiling) > 0) {
            int clamped = PositionSizer.floorToInt(ceiling.divide(price, 10, RoundingMode.HALF_UP));
            log.info(
                    "Position size clamped: market={} side={} from={} to={} ceiling={}",
                    candidate.getMarketId(),
                    candidate.getSide(),
                    contracts,
                    clamped,
                    ceiling);
            contracts = clamped;
        }

        BigDecimal openNotional = openNotional(openPositions);
        BigDecimal proposedNotional = notional(contracts, price);
        BigDecimal exposureLimit = config.getDecimal(SettingKey.MAX_TOTAL_EXPOSURE_PCT).multiply(bankroll);
        if (openNotional.add(proposedNotional).compareTo(exposureLimit) > 0) {
            return reject(
                    candidate,
                    String.format(
                            "Exposure limit: open %s + proposed %s > %s",
                            openNotional.setScale(2, RoundingMode.HALF_UP),
                            proposedNotional.setScale(2, RoundingMode.HALF_UP),
                            exposureLimit.setScale(2, RoundingMode.HALF_UP)));
        }

        String category = candidate.getCategory();
        if (category != null && !category.isBlank()) {
            int maxPerCategory = config.getInt(SettingKey.MAX_CATEGORY_POSITIONS);
            LocalDateTime windowStart = LocalDateTime.now(clock).minusHours(config.getInt(SettingKey.CATEGORY_WINDOW_HOURS));
            long sameCategory = openPositions.stream()
                    .filter(p -> category.equalsIgnoreCase(p.getCategory()))
                    .filter(p -> p.getOpenedAt() == null || !p.getOpenedAt().isBefore(windowStart))
                    .count();
            if (sameCategory >= maxPerCategory) {
                return reject(
                        candidate,
                        String.format("Correlation limit: %d open positions in category %s", sameCategory, category));
            }
        }

        if (dailyLossBreaker.evaluate(bankroll, config.getDecimal(SettingKey.DAILY_LOSS_LIMIT_PCT))) {
            return reject(candidate, REASON_DAILY_LOSS);
        }

        if (contracts <= 0) {
            return reject(candidate, "Sizing produced no positive size");
        }

        String reason = String.format(
                "Approved %d contracts (%s sizing, fraction %s, notional %s)",
                contracts,
                config.getSizingMode().name().toLowerCase(),
                sizing.getFraction(),
                notional(contracts, price).setScale(2, RoundingMode.HALF_UP));
        log.info("Trade approved: market={} side={} size={}", candidate.getMarketId(), candidate.getSide(), contracts);
        return TradeDecision.approved(contracts, reason, sizing.getFraction());
    }

    /** {@code min(max_position_pct, 0.20) * bankroll}. */
    public BigDecimal positionCeiling(BigDecimal bankroll, ConfigSnapshot config) {
        BigDecimal pct = config.getDecimal(SettingKey.MAX_POSITION_PCT).min(HARD_POSITION_CEILING);
        return pct.multiply(bankroll);
    }

    private TradeDecision reject(CandidateSignal candidate, String reason) {
        log.warn("Trade rejected: market={} side={} strategy={} reason={}",
                candidate.getMarketId(), candidate.getSide(), candidate.getStrategy().getId(), reason);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.TRADE_REJECTED,
                RiskLevel.INFO,
                reason,
                Map.of("market", candidate.getMarketId(), "side", candidate.getSide().wireValue(), "reason", reason)));
        return TradeDecision.rejected(reason);
    }

    private static BigDecimal notional(int contracts, BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(contracts));
    }

    static BigDecimal openNotional(Collection<Position> positions) {
        return positions.stream()
                .map(Position::getEntryValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
