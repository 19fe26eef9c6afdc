package com.marketloop.domain.enums;

import java.math.BigDecimal;

/** Contract side of a binary market. Wire value is the lowercase name. */
public enum Side {
    YES,
    NO;

    public Side opposite() {
        return this == YES ? NO : YES;
    }

    public String wireValue() {
        return name().toLowerCase();
    }

    /** Converts a YES-denominated price in [0,1] into this side's price. */
    public BigDecimal fromYesPrice(BigDecimal yesPrice) {
        return this == YES ? yesPrice : BigDecimal.ONE.subtract(yesPrice);
    }

    public static Side fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side must not be null");
        }
        return Side.valueOf(value.trim().toUpperCase());
    }
}
