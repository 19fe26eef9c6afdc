package com.marketloop.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for weekly performance reports. The strategy breakdown is stored as a
 * JSON object of strategy id to net PnL.
 */
@Entity
@Table(name = "weekly_reports", uniqueConstraints = @UniqueConstraint(name = "uk_weekly_reports_week", columnNames = "week_start"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeeklyReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "week_end")
    private LocalDate weekEnd;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "win_rate", precision = 6, scale = 4)
    private BigDecimal winRate;

    @Column(name = "net_pnl", precision = 15, scale = 4)
    private BigDecimal netPnl;

    @Column(name = "best_strategy", length = 20)
    private String bestStrategy;

    @Column(name = "worst_strategy", length = 20)
    private String worstStrategy;

    @Column(name = "strategy_breakdown", length = 2000)
    private String strategyBreakdown;

    @Column(length = 4000)
    private String summary;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
