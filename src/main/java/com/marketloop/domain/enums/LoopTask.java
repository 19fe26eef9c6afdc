package com.marketloop.domain.enums;

/** Independently scheduled task classes. Each one holds its own in-progress marker. */
public enum LoopTask {
    SCAN_AND_TRADE,
    POSITION_MONITOR,
    REFLECTION_WORKER,
    DAILY_REVIEW,
    RECOMMENDATION_EXPIRY,
    ADVISORY_LISTENER
}
