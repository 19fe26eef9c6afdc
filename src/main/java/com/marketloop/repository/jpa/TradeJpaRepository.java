package com.marketloop.repository.jpa;

import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.entity.TradeEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades ledger.
 * Supports the loss-trigger queries of the recommender, the daily realized PnL used to
 * restore the loss breaker, and the per-market entry lookups of the scanners.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findAllByOrderByCreatedAtDesc();

    List<TradeEntity> findByStatusOrderByCreatedAtDesc(TradeStatus status);

    Optional<TradeEntity> findFirstByMarketIdAndStatusOrderByCreatedAtDesc(String marketId, TradeStatus status);

    /** Most recently resolved trades with the given status, newest first. */
    List<TradeEntity> findByStatusOrderByResolvedAtDesc(TradeStatus status, Pageable pageable);

    @Query("SELECT COALESCE(SUM(t.netPnl), 0) FROM TradeEntity t "
            + "WHERE t.status = com.marketloop.domain.enums.TradeStatus.CLOSED AND t.resolvedAt >= :since")
    BigDecimal sumRealizedPnlSince(@Param("since") LocalDateTime since);

    @Query("SELECT COUNT(t) FROM TradeEntity t "
            + "WHERE t.status = com.marketloop.domain.enums.TradeStatus.CLOSED "
            + "AND t.netPnl < 0 AND t.resolvedAt >= :since")
    long countLossesSince(@Param("since") LocalDateTime since);

    @Query("SELECT t FROM TradeEntity t WHERE t.status = com.marketloop.domain.enums.TradeStatus.CLOSED "
            + "AND t.resolvedAt >= :from AND t.resolvedAt < :to ORDER BY t.resolvedAt")
    List<TradeEntity> findClosedBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    /** Entries made after the given time, used for per-market cooldowns. */
    List<TradeEntity> findByCreatedAtAfter(LocalDateTime since);

    List<TradeEntity> findByStatusAndReflectedFalse(TradeStatus status);
}
