package com.marketloop.risk;

import java.math.BigDecimal;
import lombok.Value;

/** Contracts proposed by the sizer and the bankroll fraction that produced them. */
@Value
public class SizingResult {

    int contracts;
    BigDecimal fraction;

    public static SizingResult none() {
        return new SizingResult(0, BigDecimal.ZERO);
    }
}
