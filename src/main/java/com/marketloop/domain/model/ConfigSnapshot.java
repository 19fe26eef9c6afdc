package com.marketloop.domain.model;

import com.marketloop.domain.enums.SizingMode;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.settings.SettingKey;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable view of the settings table taken at the start of one task invocation.
 *
 * <p>Components receive the snapshot as a call argument and must not keep it beyond
 * the invocation that produced it. Missing or unparseable values fall back to the
 * defaults declared on {@link SettingKey}.
 */
public final class ConfigSnapshot {

    private static final Logger log = LoggerFactory.getLogger(ConfigSnapshot.class);

    private final Map<String, String> values;
    private final LocalDateTime takenAt;

    public ConfigSnapshot(Map<String, String> values, LocalDateTime takenAt) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
        this.takenAt = takenAt;
    }

    /** Snapshot holding only defaults, for tests and first start before seeding. */
    public static ConfigSnapshot defaults() {
        return new ConfigSnapshot(Map.of(), LocalDateTime.now());
    }

    public ConfigSnapshot with(SettingKey key, String value) {
        Map<String, String> copy = new HashMap<>(values);
        copy.put(key.getKey(), value);
        return new ConfigSnapshot(copy, takenAt);
    }

    public String getString(SettingKey key) {
        String value = values.get(key.getKey());
        return value != null ? value.trim() : key.getDefaultValue();
    }

    public boolean getBoolean(SettingKey key) {
        return Boolean.parseBoolean(getString(key));
    }

    public BigDecimal getDecimal(SettingKey key) {
        String value = getString(key);
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.warn("Setting {} has unparseable value '{}', using default {}", key.getKey(), value,
                    key.getDefaultValue());
            return new BigDecimal(key.getDefaultValue());
        }
    }

    public int getInt(SettingKey key) {
        return getDecimal(key).intValue();
    }

    public boolean isLoopEnabled() {
        return getBoolean(SettingKey.BOT_ENABLED);
    }

    public boolean isStrategyEnabled(StrategyType strategyType) {
        return getBoolean(strategyType.getEnabledKey());
    }

    public BigDecimal getBankroll() {
        return getDecimal(SettingKey.CURRENT_BANKROLL);
    }

    public SizingMode getSizingMode() {
        String value = getString(SettingKey.SIZING_MODE);
        try {
            return SizingMode.fromSetting(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown sizing_mode '{}', falling back to {}", value, SettingKey.SIZING_MODE.getDefaultValue());
            return SizingMode.fromSetting(SettingKey.SIZING_MODE.getDefaultValue());
        }
    }

    public Map<String, String> asMap() {
        return values;
    }

    public LocalDateTime getTakenAt() {
        return takenAt;
    }
}
