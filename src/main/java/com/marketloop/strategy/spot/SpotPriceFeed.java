package com.marketloop.strategy.spot;

import java.math.BigDecimal;
import java.util.Optional;

/** Source of the BTC/USD spot price used by the BTC threshold scanner. */
public interface SpotPriceFeed {

    /** Latest price, or the last good one when the source fails; empty if none was ever seen. */
    Optional<BigDecimal> currentBtcPrice();
}
