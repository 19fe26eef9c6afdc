package com.marketloop.strategy.spot;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.config.ExchangeProperties;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Keyless CoinGecko spot price. Caches the last good price and serves it when a fetch
 * fails.
 */
@Component
public class CoinGeckoSpotPriceFeed implements SpotPriceFeed {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoSpotPriceFeed.class);

    private final RestTemplate restTemplate;
    private final ExchangeProperties exchangeProperties;
    private final AtomicReference<BigDecimal> lastGoodPrice = new AtomicReference<>();

    public CoinGeckoSpotPriceFeed(
            @Qualifier("spotPriceRestTemplate") RestTemplate restTemplate, ExchangeProperties exchangeProperties) {
        this.restTemplate = restTemplate;
        this.exchangeProperties = exchangeProperties;
    }

    @Override
    public Optional<BigDecimal> currentBtcPrice() {
        try {
            JsonNode body = restTemplate.getForObject(exchangeProperties.getSpotPriceUrl(), JsonNode.class);
            JsonNode usd = body != null ? body.path("bitcoin").path("usd") : null;
            if (usd != null && usd.isNumber() && usd.decimalValue().signum() > 0) {
                lastGoodPrice.set(usd.decimalValue());
                log.debug("BTC spot price = {}", usd.decimalValue());
                return Optional.of(usd.decimalValue());
            }
            log.warn("BTC spot response missing price: {}", body);
        } catch (RestClientException e) {
            log.warn("BTC spot fetch failed: {}", e.getMessage());
        }
        BigDecimal cached = lastGoodPrice.get();
        if (cached != null) {
            log.info("Using cached BTC spot price {}", cached);
        }
        return Optional.ofNullable(cached);
    }
}
