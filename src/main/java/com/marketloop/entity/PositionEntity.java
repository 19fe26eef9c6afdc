package com.marketloop.entity;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for open positions. The unique constraint on market_id backs the
 * one-position-per-market check made by the execution engine.
 */
@Entity
@Table(name = "positions", uniqueConstraints = @UniqueConstraint(name = "uk_positions_market", columnNames = "market_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "market_id", length = 100, nullable = false)
    private String marketId;

    @Column(name = "market_title", length = 500)
    private String marketTitle;

    @Column(length = 100)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private StrategyType strategy;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(5)")
    private Side side;

    private int size;

    @Column(name = "entry_price", precision = 10, scale = 4)
    private BigDecimal entryPrice;

    @Column(name = "current_price", precision = 10, scale = 4)
    private BigDecimal currentPrice;

    @Column(name = "unrealized_pnl", precision = 15, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(name = "trade_id", length = 36)
    private String tradeId;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "entry_order_id", length = 100)
    private String entryOrderId;

    @Column(name = "exit_order_id", length = 100)
    private String exitOrderId;

    @Column(name = "exit_price", precision = 10, scale = 4)
    private BigDecimal exitPrice;

    @Column(name = "exit_reason", length = 500)
    private String exitReason;
}
