package com.marketloop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the exchange REST API.
 *
 * <pre>
 * marketloop.exchange.base-url=https://api.elections.kalshi.com
 * marketloop.exchange.api-prefix=/trade-api/v2
 * marketloop.exchange.api-key=${EXCHANGE_API_KEY:}
 * marketloop.exchange.api-secret=${EXCHANGE_API_SECRET:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketloop.exchange")
public class ExchangeProperties {

    private String baseUrl = "https://api.elections.kalshi.com";
    private String apiPrefix = "/trade-api/v2";
    private String apiKey;

    /** Base64-encoded signing secret. */
    private String apiSecret;

    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 10_000;

    /** Series ticker scanned by the BTC threshold scanner. */
    private String btcSeriesTicker = "KXBTC";

    /** Spot price endpoint for the BTC scanner. */
    private String spotPriceUrl = "https://api.coingecko.com/api/v3/simple/price?ids=bitcoin&vs_currencies=usd";
}
