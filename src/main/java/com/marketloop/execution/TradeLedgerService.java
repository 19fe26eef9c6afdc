package com.marketloop.execution;

import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.entity.PositionEntity;
import com.marketloop.entity.TradeEntity;
import com.marketloop.exception.ResourceNotFoundException;
import com.marketloop.mapper.PositionMapper;
import com.marketloop.mapper.TradeMapper;
import com.marketloop.repository.jpa.PositionJpaRepository;
import com.marketloop.repository.jpa.TradeJpaRepository;
import com.marketloop.settings.SettingKey;
import com.marketloop.settings.SettingsService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence side of the execution engine. Each state change of a trade and its
 * position happens in one transaction, so a position never exists without its open
 * trade row and a closed trade never leaves a position behind.
 */
@Service
public class TradeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(TradeLedgerService.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final TradeMapper tradeMapper;
    private final PositionMapper positionMapper;
    private final SettingsService settingsService;
    private final FeeCalculator feeCalculator;
    private final Clock clock;

    public TradeLedgerService(
            TradeJpaRepository tradeJpaRepository,
            PositionJpaRepository positionJpaRepository,
            TradeMapper tradeMapper,
            PositionMapper positionMapper,
            SettingsService settingsService,
            FeeCalculator feeCalculator,
            Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.tradeMapper = tradeMapper;
        this.positionMapper = positionMapper;
        this.settingsService = settingsService;
        this.feeCalculator = feeCalculator;
        this.clock = clock;
    }

    /** Writes the open trade row and its position together. */
    @Transactional
    public TradeRecord openTrade(CandidateSignal signal, int size, String orderId) {
        LocalDateTime now = LocalDateTime.now(clock);
        TradeRecord trade = TradeRecord.builder()
                .id(UUID.randomUUID().toString())
                .marketId(signal.getMarketId())
                .marketTitle(signal.getMarketTitle())
                .category(signal.getCategory())
                .strategy(signal.getStrategy())
                .side(signal.getSide())
                .size(size)
                .entryPrice(signal.getEntryPrice())
                .status(TradeStatus.OPEN)
                .entryRationale(signal.getRationale())
                .orderId(orderId)
                .createdAt(now)
                .build();
        tradeJpaRepository.save(tradeMapper.toEntity(trade));

        Position position = Position.builder()
                .marketId(signal.getMarketId())
                .marketTitle(signal.getMarketTitle())
                .category(signal.getCategory())
                .strategy(signal.getStrategy())
                .side(signal.getSide())
                .size(size)
                .entryPrice(signal.getEntryPrice())
                .currentPrice(signal.getEntryPrice())
                .unrealizedPnl(BigDecimal.ZERO)
                .tradeId(trade.getId())
                .openedAt(now)
                .expiresAt(signal.getExpiresAt())
                .entryOrderId(orderId)
                .build();
        positionJpaRepository.saveAndFlush(positionMapper.toEntity(position));

        log.info(
                "Trade opened: id={} market={} side={} size={} price={} order={}",
                trade.getId(),
                trade.getMarketId(),
                trade.getSide(),
                size,
                trade.getEntryPrice(),
                orderId);
        return trade;
    }

    /**
     * Finalizes the trade at {@code exitPrice}, deletes the position and moves the
     * bankroll by the net PnL.
     */
    @Transactional
    public TradeRecord closeTrade(Position position, BigDecimal exitPrice, String exitReason, BigDecimal feePerContract) {
        TradeEntity entity = tradeJpaRepository
                .findById(position.getTradeId())
                .orElseThrow(() -> new ResourceNotFoundException("Trade", position.getTradeId()));

        BigDecimal gross = feeCalculator.grossPnl(entity.getEntryPrice(), exitPrice, entity.getSize());
        BigDecimal fees = feeCalculator.roundTripFees(entity.getSize(), feePerContract);
        BigDecimal net = gross.subtract(fees);

        entity.setExitPrice(exitPrice);
        entity.setGrossPnl(gross);
        entity.setFees(fees);
        entity.setNetPnl(net);
        entity.setStatus(TradeStatus.CLOSED);
        entity.setExitReason(exitReason);
        entity.setResolvedAt(LocalDateTime.now(clock));
        tradeJpaRepository.save(entity);

        positionJpaRepository.findByMarketId(position.getMarketId()).ifPresent(positionJpaRepository::delete);

        BigDecimal bankroll = settingsService.snapshot().getBankroll().add(net);
        settingsService.write(
                SettingKey.CURRENT_BANKROLL,
                bankroll.stripTrailingZeros().toPlainString(),
                SettingsService.CHANGED_BY_SYSTEM,
                "Trade " + entity.getId() + " closed");

        log.info(
                "Trade closed: id={} market={} exit={} gross={} fees={} net={} reason={}",
                entity.getId(),
                entity.getMarketId(),
                exitPrice,
                gross,
                fees,
                net,
                exitReason);
        return tradeMapper.toDomain(entity);
    }

    /** Marks an open trade cancelled and removes its position. No PnL is booked. */
    @Transactional
    public TradeRecord cancelTrade(String tradeId, String reason) {
        TradeEntity entity = tradeJpaRepository
                .findById(tradeId)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
        entity.setStatus(TradeStatus.CANCELLED);
        entity.setExitReason(reason);
        entity.setResolvedAt(LocalDateTime.now(clock));
        tradeJpaRepository.save(entity);
        positionJpaRepository.findByMarketId(entity.getMarketId()).ifPresent(positionJpaRepository::delete);
        log.info("Trade cancelled: id={} market={} reason={}", tradeId, entity.getMarketId(), reason);
        return tradeMapper.toDomain(entity);
    }

    /**
     * Records an exit about to be sent, in its own transaction, before the SELL leaves.
     *
     * @throws ResourceNotFoundException when the position is already gone
     */
    @Transactional
    public void markExiting(String marketId, String exitOrderId, BigDecimal exitPrice, String exitReason) {
        PositionEntity entity = positionJpaRepository
                .findByMarketId(marketId)
                .orElseThrow(() -> new ResourceNotFoundException("Position", marketId));
        entity.setExitOrderId(exitOrderId);
        entity.setExitPrice(exitPrice);
        entity.setExitReason(exitReason);
        positionJpaRepository.saveAndFlush(entity);
    }

    /** Reverts {@link #markExiting} after the exit order was refused. */
    @Transactional
    public void clearExiting(String marketId) {
        positionJpaRepository.findByMarketId(marketId).ifPresent(entity -> {
            entity.setExitOrderId(null);
            entity.setExitPrice(null);
            entity.setExitReason(null);
            positionJpaRepository.saveAndFlush(entity);
        });
    }

    /** Shrinks a partially filled entry to the contracts actually bought. */
    @Transactional
    public void resizeEntry(String tradeId, int filledSize) {
        TradeEntity trade = tradeJpaRepository
                .findById(tradeId)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
        int previous = trade.getSize();
        trade.setSize(filledSize);
        tradeJpaRepository.save(trade);
        positionJpaRepository.findByMarketId(trade.getMarketId()).ifPresent(position -> {
            position.setSize(filledSize);
            positionJpaRepository.save(position);
        });
        log.info("Entry resized: trade={} market={} size {} -> {}", tradeId, trade.getMarketId(), previous, filledSize);
    }

    @Transactional
    public void updateMark(Position position) {
        positionJpaRepository.findByMarketId(position.getMarketId()).ifPresent(entity -> {
            entity.setCurrentPrice(position.getCurrentPrice());
            entity.setUnrealizedPnl(position.getUnrealizedPnl());
            positionJpaRepository.save(entity);
        });
    }

    @Transactional(readOnly = true)
    public boolean hasPosition(String marketId) {
        return positionJpaRepository.existsByMarketId(marketId);
    }

    @Transactional(readOnly = true)
    public List<Position> getOpenPositions() {
        return positionMapper.toDomainList(positionJpaRepository.findAll());
    }

    /** All trades newest first, optionally filtered by status. */
    @Transactional(readOnly = true)
    public List<TradeRecord> getTrades(TradeStatus status) {
        List<TradeEntity> entities = status == null
                ? tradeJpaRepository.findAllByOrderByCreatedAtDesc()
                : tradeJpaRepository.findByStatusOrderByCreatedAtDesc(status);
        return tradeMapper.toDomainList(entities);
    }

    @Transactional(readOnly = true)
    public Optional<TradeRecord> getTrade(String tradeId) {
        return tradeJpaRepository.findById(tradeId).map(tradeMapper::toDomain);
    }

    /** Latest entry time per market since {@code since}, for scanner cooldowns. */
    @Transactional(readOnly = true)
    public Map<String, LocalDateTime> lastEntriesSince(LocalDateTime since) {
        Map<String, LocalDateTime> latest = new HashMap<>();
        for (TradeEntity entity : tradeJpaRepository.findByCreatedAtAfter(since)) {
            latest.merge(entity.getMarketId(), entity.getCreatedAt(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return latest;
    }
}
