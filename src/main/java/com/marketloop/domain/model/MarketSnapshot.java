package com.marketloop.domain.model;

import com.marketloop.domain.enums.Side;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of one exchange market. Prices are YES-denominated fractions in
 * [0,1]; any of them may be null when the book is empty on that side.
 */
@Value
@Builder
public class MarketSnapshot {

    private static final Set<String> RESOLVED_STATUSES = Set.of("settled", "finalized", "determined", "resolved");

    String ticker;
    String title;
    String category;
    String status;

    /** "yes" or "no" once the market has resolved, otherwise blank. */
    String result;

    BigDecimal yesBid;
    BigDecimal yesAsk;
    BigDecimal noBid;
    BigDecimal noAsk;
    BigDecimal lastPrice;
    BigDecimal volume;
    LocalDateTime closeTime;

    public boolean isResolved() {
        return status != null
                && RESOLVED_STATUSES.contains(status.toLowerCase())
                && resultSide().isPresent();
    }

    public Optional<Side> resultSide() {
        if (result == null || result.isBlank()) {
            return Optional.empty();
        }
        String normalized = result.trim().toLowerCase();
        if (normalized.equals("yes")) {
            return Optional.of(Side.YES);
        }
        if (normalized.equals("no")) {
            return Optional.of(Side.NO);
        }
        return Optional.empty();
    }

    /** Mark price of the YES side: last trade, else the YES ask. */
    public Optional<BigDecimal> markYesPrice() {
        if (lastPrice != null && lastPrice.signum() > 0) {
            return Optional.of(lastPrice);
        }
        return Optional.ofNullable(yesAsk);
    }

    public Optional<BigDecimal> markPrice(Side side) {
        return markYesPrice().map(side::fromYesPrice);
    }

    /** Hours from {@code now} to close; negative once closed, NaN when unknown. */
    public double hoursToClose(LocalDateTime now) {
        if (closeTime == null) {
            return Double.NaN;
        }
        return Duration.between(now, closeTime).toMillis() / 3_600_000.0;
    }

    public BigDecimal volumeOrZero() {
        return volume != null ? volume : BigDecimal.ZERO;
    }
}
