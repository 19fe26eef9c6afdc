package com.marketloop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static loop infrastructure settings. Trading parameters are not here; they live in
 * the settings table so they can change without a restart.
 *
 * <pre>
 * marketloop.loop.paper-trade=true
 * marketloop.loop.scan-interval-ms=60000
 * marketloop.loop.monitor-interval-ms=30000
 * marketloop.loop.reflection-interval-ms=5000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketloop.loop")
public class LoopProperties {

    /** When true, orders are never sent to the exchange and ids are synthesized. */
    private boolean paperTrade = true;

    private long scanIntervalMs = 60_000;
    private long monitorIntervalMs = 30_000;
    private long reflectionIntervalMs = 5_000;

    /** Markets fetched per scanner per cycle. */
    private int marketFetchLimit = 200;

    private int reflectionQueueCapacity = 500;

    /** Upper bound on how long shutdown waits for in-flight tasks. */
    private long shutdownWaitMs = 20_000;
}
