package com.marketloop.monitor;

import java.math.BigDecimal;
import lombok.Value;

/** Why a position should be closed, and at what settlement price when the market has resolved. */
@Value
public class ExitDecision {

    String reason;
    BigDecimal settlementPrice;

    public static ExitDecision settle(String reason, BigDecimal settlementPrice) {
        return new ExitDecision(reason, settlementPrice);
    }

    public static ExitDecision exit(String reason) {
        return new ExitDecision(reason, null);
    }
}
