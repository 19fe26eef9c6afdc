package com.marketloop.domain.enums;

/**
 * How the risk gate turns an approved candidate into a contract count. Exactly one
 * mode is active at a time, selected by the {@code sizing_mode} setting.
 */
public enum SizingMode {
    KELLY,
    FIXED_DOLLAR;

    public static SizingMode fromSetting(String value) {
        return SizingMode.valueOf(value.trim().toUpperCase());
    }
}
