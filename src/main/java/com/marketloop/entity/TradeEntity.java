package com.marketloop.entity;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades ledger.
 * One row per entry/exit round trip; exit columns stay null while the trade is open.
 */
@Entity
@Table(
        name = "trades",
        indexes = {
            @Index(name = "idx_trades_status", columnList = "status"),
            @Index(name = "idx_trades_resolved_at", columnList = "resolved_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

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

    @Column(name = "exit_price", precision = 10, scale = 4)
    private BigDecimal exitPrice;

    @Column(precision = 15, scale = 4)
    private BigDecimal fees;

    @Column(name = "gross_pnl", precision = 15, scale = 4)
    private BigDecimal grossPnl;

    @Column(name = "net_pnl", precision = 15, scale = 4)
    private BigDecimal netPnl;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(12)")
    private TradeStatus status;

    @Column(name = "entry_rationale", length = 2000)
    private String entryRationale;

    @Column(name = "exit_reason", length = 500)
    private String exitReason;

    @Column(name = "order_id", length = 100)
    private String orderId;

    private boolean reflected;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
