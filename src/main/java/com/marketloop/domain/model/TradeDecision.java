package com.marketloop.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** Outcome of the risk gate for one candidate. */
@Value
public class TradeDecision {

    boolean approved;
    int recommendedSize;
    String reason;
    BigDecimal sizingFraction;

    public static TradeDecision approved(int size, String reason, BigDecimal sizingFraction) {
        return new TradeDecision(true, size, reason, sizingFraction);
    }

    public static TradeDecision rejected(String reason) {
        return new TradeDecision(false, 0, reason, BigDecimal.ZERO);
    }
}
