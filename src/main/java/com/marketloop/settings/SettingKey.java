package com.marketloop.settings;

import com.marketloop.domain.enums.ParamType;
import java.util.Arrays;
import java.util.Optional;

/**
 * Every key the loop reads from the {@code settings} table, with the default used
 * when the row is missing or unparseable. Rows are seeded from these defaults on startup.
 */
public enum SettingKey {
    BOT_ENABLED("bot_enabled", "true", ParamType.BOOLEAN),
    BOND_STRATEGY_ENABLED("bond_strategy_enabled", "true", ParamType.BOOLEAN),
    MARKET_MAKING_ENABLED("market_making_enabled", "true", ParamType.BOOLEAN),
    BTC_STRATEGY_ENABLED("btc_strategy_enabled", "true", ParamType.BOOLEAN),
    NEWS_STRATEGY_ENABLED("news_strategy_enabled", "true", ParamType.BOOLEAN),

    CURRENT_BANKROLL("current_bankroll", "5000", ParamType.DECIMAL),
    SIZING_MODE("sizing_mode", "kelly", ParamType.TEXT),
    FIXED_TRADE_AMOUNT("fixed_trade_amount", "5", ParamType.DECIMAL),
    KELLY_FRACTION("kelly_fraction", "0.5", ParamType.DECIMAL),

    MIN_EDGE("min_edge", "0.02", ParamType.DECIMAL),
    SCORE_HORIZON_HOURS("score_horizon_hours", "48", ParamType.INT),
    MAX_SIGNALS_PER_CYCLE("max_signals_per_cycle", "5", ParamType.INT),

    MIN_MARKET_VOLUME("min_market_volume", "5000", ParamType.DECIMAL),
    MAX_POSITION_PCT("max_position_pct", "0.15", ParamType.DECIMAL),
    MAX_TOTAL_EXPOSURE_PCT("max_total_exposure_pct", "0.60", ParamType.DECIMAL),
    MAX_CATEGORY_POSITIONS("max_category_positions", "2", ParamType.INT),
    CATEGORY_WINDOW_HOURS("category_window_hours", "48", ParamType.INT),
    DAILY_LOSS_LIMIT_PCT("daily_loss_limit_pct", "0.03", ParamType.DECIMAL),

    FEE_PER_CONTRACT("fee_per_contract", "0.07", ParamType.DECIMAL),
    BOND_STOP_LOSS_CENTS("bond_stop_loss_cents", "0.06", ParamType.DECIMAL),
    STOP_LOSS_THRESHOLD("stop_loss_threshold", "0.50", ParamType.DECIMAL),
    BTC_TAKE_PROFIT_PCT("btc_take_profit_pct", "0.30", ParamType.DECIMAL),
    MM_MAX_HOLD_HOURS("mm_max_hold_hours", "4", ParamType.INT),
    BOND_PRE_EXPIRY_SEC("bond_pre_expiry_sec", "300", ParamType.INT),
    MM_PRE_EXPIRY_SEC("mm_pre_expiry_sec", "600", ParamType.INT),
    BTC_PRE_EXPIRY_SEC("btc_pre_expiry_sec", "60", ParamType.INT),
    NEWS_PRE_EXPIRY_SEC("news_pre_expiry_sec", "300", ParamType.INT),
    ALERT_THRESHOLD("alert_threshold", "0.10", ParamType.DECIMAL),
    ENTRY_FILL_TIMEOUT_SEC("entry_fill_timeout_sec", "300", ParamType.INT),

    CONSECUTIVE_LOSS_TRIGGER("consecutive_loss_trigger", "3", ParamType.INT),
    CUMULATIVE_LOSS_TRIGGER("cumulative_loss_trigger", "10", ParamType.INT),
    CUMULATIVE_LOSS_WINDOW_DAYS("cumulative_loss_window_days", "7", ParamType.INT),
    RECOMMENDATION_EXPIRY_DAYS("recommendation_expiry_days", "7", ParamType.INT);

    private final String key;
    private final String defaultValue;
    private final ParamType type;

    SettingKey(String key, String defaultValue, ParamType type) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.type = type;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public ParamType getType() {
        return type;
    }

    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
