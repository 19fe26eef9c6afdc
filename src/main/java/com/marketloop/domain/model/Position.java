package com.marketloop.domain.model;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open holding in one market. There is never more than one per market id.
 *
 * <p>{@code entryPrice} and {@code currentPrice} are prices of the held side, so a
 * rising price is always favourable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private Long id;
    private String marketId;
    private String marketTitle;
    private String category;
    private StrategyType strategy;
    private Side side;
    private int size;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal unrealizedPnl;
    private String tradeId;
    private LocalDateTime openedAt;
    private LocalDateTime expiresAt;

    /** Exchange id of the BUY that opened the position. */
    private String entryOrderId;

    /**
     * Client order id of an exit already sent. Set before the SELL goes out so a retry
     * after a failed ledger write finalizes instead of selling again.
     */
    private String exitOrderId;

    private BigDecimal exitPrice;
    private String exitReason;

    public boolean isExiting() {
        return exitOrderId != null;
    }

    /** Capital committed at entry. */
    public BigDecimal getEntryValue() {
        return entryPrice.multiply(BigDecimal.valueOf(size));
    }
}
