package com.marketloop.reporting;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate results over a set of closed trades. Input to weekly reports and to the
 * recommender's prompts.
 */
@Data
@Builder
public class PerformanceStats {

    private int totalTrades;
    private int wins;
    private int losses;

    /** Percentage, 0 to 100. */
    private BigDecimal winRate;

    private BigDecimal netPnl;
    private String bestStrategy;
    private String worstStrategy;

    /** Net PnL per strategy id, best first. */
    private Map<String, BigDecimal> strategyBreakdown;

    public static PerformanceStats empty() {
        return PerformanceStats.builder()
                .winRate(BigDecimal.ZERO)
                .netPnl(BigDecimal.ZERO)
                .bestStrategy("none")
                .worstStrategy("none")
                .strategyBreakdown(Map.of())
                .build();
    }
}
