package com.marketloop.api.dto.response;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /api/health/detailed: store reachability, loop and breaker state,
 * per-task status and run mode.
 */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" or "DEGRADED". */
    private final String status;

    private final String store;
    private final boolean loopEnabled;
    private final boolean breakerLatched;
    private final boolean paperTrade;
    private final boolean reasoningEnabled;

    /** Task name to {@code {lastRun, inProgress}}. */
    private final Map<String, Map<String, Object>> tasks;
}
