package com.marketloop.recovery;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Outcome of the startup recovery sequence, one field per step. */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    private int settingsSeeded;
    private BigDecimal restoredDailyPnl;
    private int openPositions;
    private int reflectionsRequeued;
    private boolean reasoningReachable;
}
