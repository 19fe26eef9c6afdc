package com.marketloop.config;

import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per external service, each with finite connect and read timeouts.
 */
@Configuration
public class RestClientConfig {

    @Bean("exchangeRestTemplate")
    public RestTemplate exchangeRestTemplate(RestTemplateBuilder builder, ExchangeProperties properties) {
        return builder.rootUri(properties.getBaseUrl())
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    @Bean("reasoningRestTemplate")
    public RestTemplate reasoningRestTemplate(RestTemplateBuilder builder, ReasoningProperties properties) {
        return builder.rootUri(properties.getBaseUrl())
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    @Bean("spotPriceRestTemplate")
    public RestTemplate spotPriceRestTemplate(RestTemplateBuilder builder, ExchangeProperties properties) {
        return builder.connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    @Bean("advisoryFeedRestTemplate")
    public RestTemplate advisoryFeedRestTemplate(RestTemplateBuilder builder, AdvisoryProperties properties) {
        return builder.connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }
}
