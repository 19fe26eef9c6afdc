package com.marketloop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the advisory reasoning service. With no API key configured the service
 * is treated as disabled and every call returns empty.
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketloop.reasoning")
public class ReasoningProperties {

    private boolean enabled = true;
    private String baseUrl = "https://api.anthropic.com";
    private String apiKey;
    private String model = "claude-sonnet-4-5";
    private String apiVersion = "2023-06-01";
    private int maxTokens = 1024;
    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 30_000;

    public boolean isActive() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }
}
