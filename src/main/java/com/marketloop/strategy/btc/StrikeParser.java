package com.marketloop.strategy.btc;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a BTC dollar strike from a market title or ticker.
 *
 * <p>Dollar amounts ({@code "above $95,000"}) are tried first, then ticker suffixes
 * such as {@code KXBTC-25MAR01-B90000}. Values outside [1,000, 2,000,000] are ignored.
 */
public final class StrikeParser {

    private static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$([0-9,]+(?:\\.[0-9]+)?)");
    private static final Pattern TICKER_SUFFIX = Pattern.compile("[B-](\\d{4,7})\\b");
    private static final double MIN_STRIKE = 1_000;
    private static final double MAX_STRIKE = 2_000_000;

    private StrikeParser() {}

    public static Optional<Double> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher dollars = DOLLAR_AMOUNT.matcher(text);
        while (dollars.find()) {
            Optional<Double> strike = toStrike(dollars.group(1).replace(",", ""));
            if (strike.isPresent()) {
                return strike;
            }
        }
        Matcher suffix = TICKER_SUFFIX.matcher(text);
        if (suffix.find()) {
            return toStrike(suffix.group(1));
        }
        return Optional.empty();
    }

    private static Optional<Double> toStrike(String digits) {
        try {
            double value = Double.parseDouble(digits);
            return value >= MIN_STRIKE && value <= MAX_STRIKE ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
