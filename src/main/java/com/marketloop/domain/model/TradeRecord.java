package com.marketloop.domain.model;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger entry for one entry/exit round trip. Opened at execution, finalized once at
 * close or cancel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {

    private String id;
    private String marketId;
    private String marketTitle;
    private String category;
    private StrategyType strategy;
    private Side side;
    private int size;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal fees;
    private BigDecimal grossPnl;
    private BigDecimal netPnl;
    private TradeStatus status;
    private String entryRationale;
    private String exitReason;
    private String orderId;
    private boolean reflected;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;

    public boolean isLoss() {
        return netPnl != null && netPnl.signum() < 0;
    }
}
