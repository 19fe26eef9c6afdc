package com.marketloop.strategy;

import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.Position;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Read-only inputs shared by all scanners for one cycle.
 */
@Getter
@Builder
public class ScanContext {

    /** Open positions keyed by market id. */
    private final Map<String, Position> openPositions;

    private final List<ExchangeOrder> restingOrders;

    /** Most recent entry time per market id. */
    private final Map<String, LocalDateTime> lastEntryByMarket;

    private final ConfigSnapshot config;
    private final LocalDateTime now;
    private final int marketFetchLimit;

    public boolean isHeld(String marketId) {
        return openPositions.containsKey(marketId);
    }

    public boolean hasRestingOrders(String marketId) {
        return restingOrders.stream().anyMatch(order -> marketId.equals(order.getMarketId()));
    }

    public boolean enteredWithin(String marketId, Duration window) {
        LocalDateTime lastEntry = lastEntryByMarket.get(marketId);
        return lastEntry != null && lastEntry.isAfter(now.minus(window));
    }
}
