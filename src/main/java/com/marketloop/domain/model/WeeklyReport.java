package com.marketloop.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyReport {

    private Long id;
    private LocalDate weekStart;
    private LocalDate weekEnd;
    private int totalTrades;
    private BigDecimal winRate;
    private BigDecimal netPnl;
    private String bestStrategy;
    private String worstStrategy;

    /** Net PnL per strategy id. */
    private Map<String, BigDecimal> strategyBreakdown;

    private String summary;
    private LocalDateTime createdAt;
}
