package com.marketloop.domain.model;

import com.marketloop.domain.enums.Side;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import lombok.Value;

/**
 * Resting bids per side. A binary book carries no asks: the ask for one side is
 * implied by the best bid on the other, {@code ask = (100 - oppositeBid) / 100}.
 */
@Value
public class OrderBook {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    String ticker;
    List<Level> yesBids;
    List<Level> noBids;

    @Value
    public static class Level {
        int priceCents;
        int quantity;
    }

    public Optional<Integer> bestBidCents(Side side) {
        List<Level> levels = side == Side.YES ? yesBids : noBids;
        if (levels == null) {
            return Optional.empty();
        }
        return levels.stream().map(Level::getPriceCents).max(Integer::compare);
    }

    public Optional<BigDecimal> bestBid(Side side) {
        return bestBidCents(side).map(cents -> BigDecimal.valueOf(cents).divide(HUNDRED, 2, RoundingMode.UNNECESSARY));
    }

    public Optional<BigDecimal> bestAsk(Side side) {
        return bestBidCents(side.opposite())
                .map(cents -> BigDecimal.valueOf(100 - cents).divide(HUNDRED, 2, RoundingMode.UNNECESSARY));
    }
}
