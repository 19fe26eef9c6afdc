package com.marketloop.domain.enums;

public enum RecommendationTrigger {
    CONSECUTIVE_LOSSES,
    CUMULATIVE_LOSSES,
    WEEKLY_REPORT;

    public boolean isLossTrigger() {
        return this != WEEKLY_REPORT;
    }
}
