package com.marketloop.settings;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * Settings that the recommender is allowed to propose changes for, with the inclusive
 * bounds any new value must respect. Values are validated here both when a proposal is
 * created and again when it is approved.
 */
public enum TunableParameter {
    BOND_STOP_LOSS_CENTS(
            SettingKey.BOND_STOP_LOSS_CENTS,
            "0.02",
            "0.10",
            "Bond stop-loss as an absolute price drop from entry (0.06 = 6 cents)"),
    STOP_LOSS_THRESHOLD(
            SettingKey.STOP_LOSS_THRESHOLD,
            "0.20",
            "0.70",
            "Fractional stop-loss for market making and BTC positions (0.50 = exit at 50% loss of entry value)"),
    BTC_TAKE_PROFIT_PCT(
            SettingKey.BTC_TAKE_PROFIT_PCT, "0.10", "0.60", "BTC take-profit as a fraction of entry value"),
    MM_MAX_HOLD_HOURS(
            SettingKey.MM_MAX_HOLD_HOURS, "1", "12", "Hours a market-making position may be held before forced exit"),
    BOND_PRE_EXPIRY_SEC(SettingKey.BOND_PRE_EXPIRY_SEC, "60", "900", "Seconds before close to exit bond positions"),
    MM_PRE_EXPIRY_SEC(
            SettingKey.MM_PRE_EXPIRY_SEC, "120", "1800", "Seconds before close to exit market-making positions"),
    BTC_PRE_EXPIRY_SEC(SettingKey.BTC_PRE_EXPIRY_SEC, "15", "300", "Seconds before close to exit BTC positions"),
    MAX_POSITION_PCT(
            SettingKey.MAX_POSITION_PCT, "0.05", "0.25", "Maximum single position as a fraction of bankroll"),
    DAILY_LOSS_LIMIT_PCT(
            SettingKey.DAILY_LOSS_LIMIT_PCT, "0.01", "0.10", "Daily realized loss limit as a fraction of bankroll");

    private final SettingKey settingKey;
    private final BigDecimal min;
    private final BigDecimal max;
    private final String description;

    TunableParameter(SettingKey settingKey, String min, String max, String description) {
        this.settingKey = settingKey;
        this.min = new BigDecimal(min);
        this.max = new BigDecimal(max);
        this.description = description;
    }

    public SettingKey getSettingKey() {
        return settingKey;
    }

    public String getKey() {
        return settingKey.getKey();
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<TunableParameter> fromKey(String key) {
        return Arrays.stream(values()).filter(p -> p.getKey().equals(key)).findFirst();
    }
}
