package com.marketloop.execution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/** Round-trip fee and PnL arithmetic for one closed trade. */
@Component
public class FeeCalculator {

    private static final int SCALE = 4;

    /** Fee charged on both the entry and the exit leg. */
    public BigDecimal roundTripFees(int size, BigDecimal feePerContract) {
        return feePerContract
                .multiply(BigDecimal.valueOf(size))
                .multiply(BigDecimal.valueOf(2))
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal grossPnl(BigDecimal entryPrice, BigDecimal exitPrice, int size) {
        return exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(size)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal unrealizedPnl(BigDecimal entryPrice, BigDecimal currentPrice, int size) {
        return grossPnl(entryPrice, currentPrice, size);
    }

    /** Converts a price fraction into whole cents within the exchange's 1..99 band. */
    public static int toCents(BigDecimal price) {
        int cents = price.movePointRight(2).setScale(0, RoundingMode.HALF_UP).intValue();
        return Math.max(1, Math.min(99, cents));
    }
}
