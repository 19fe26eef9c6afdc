package com.marketloop.domain.enums;

import com.marketloop.settings.SettingKey;
import java.util.Optional;

/**
 * Signal producer families. Each one owns its enable toggle and the settings that
 * drive its exit rules in the position monitor.
 */
public enum StrategyType {
    BOND("bond", SettingKey.BOND_STRATEGY_ENABLED, SettingKey.BOND_PRE_EXPIRY_SEC, null),
    MARKET_MAKING(
            "market_making",
            SettingKey.MARKET_MAKING_ENABLED,
            SettingKey.MM_PRE_EXPIRY_SEC,
            SettingKey.MM_MAX_HOLD_HOURS),
    BTC_THRESHOLD("btc_threshold", SettingKey.BTC_STRATEGY_ENABLED, SettingKey.BTC_PRE_EXPIRY_SEC, null),
    /** Produced by the advisory listener, not by the scan cycle. */
    NEWS_ARBITRAGE("news_arbitrage", SettingKey.NEWS_STRATEGY_ENABLED, SettingKey.NEWS_PRE_EXPIRY_SEC, null);

    private final String id;
    private final SettingKey enabledKey;
    private final SettingKey preExpiryKey;
    private final SettingKey maxHoldKey;

    StrategyType(String id, SettingKey enabledKey, SettingKey preExpiryKey, SettingKey maxHoldKey) {
        this.id = id;
        this.enabledKey = enabledKey;
        this.preExpiryKey = preExpiryKey;
        this.maxHoldKey = maxHoldKey;
    }

    public String getId() {
        return id;
    }

    public SettingKey getEnabledKey() {
        return enabledKey;
    }

    public SettingKey getPreExpiryKey() {
        return preExpiryKey;
    }

    /** Maximum-hold setting in hours, when the strategy has one. */
    public Optional<SettingKey> getMaxHoldKey() {
        return Optional.ofNullable(maxHoldKey);
    }

    public static StrategyType fromId(String id) {
        for (StrategyType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + id);
    }
}
