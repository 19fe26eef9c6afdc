package com.marketloop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Headline feed polled by the advisory listener. A blank feed URL turns the listener
 * off.
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketloop.advisory")
public class AdvisoryProperties {

    private String feedUrl;
    private String apiKey;
    private long pollIntervalMs = 60_000;

    /** Headline ids remembered for de-duplication; oldest are evicted first. */
    private int seenCapacity = 5_000;

    private int maxHeadlinesPerPoll = 20;
    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 10_000;

    public boolean isConfigured() {
        return feedUrl != null && !feedUrl.isBlank();
    }
}
