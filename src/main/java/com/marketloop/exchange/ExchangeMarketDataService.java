package com.marketloop.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.model.AccountBalance;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.ExchangePosition;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.OrderBook;
import com.marketloop.exchange.mapper.ExchangeWireMapper;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-side exchange calls. Internal to {@link RestExchangeGateway}.
 *
 * <p>Every method carries {@code @Retry(name = "exchangeRead")}: bounded exponential
 * backoff on {@link com.marketloop.exception.ExchangeUnavailableException} only.
 * Reads are idempotent, so retrying them cannot duplicate an action.
 */
@Service
public class ExchangeMarketDataService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeMarketDataService.class);

    /** The exchange's maximum page size for market listings. */
    static final int MAX_PAGE_SIZE = 200;

    private final ExchangeHttpClient exchangeHttpClient;
    private final ExchangeWireMapper exchangeWireMapper;
    private final Clock clock;

    public ExchangeMarketDataService(
            ExchangeHttpClient exchangeHttpClient, ExchangeWireMapper exchangeWireMapper, Clock clock) {
        this.exchangeHttpClient = exchangeHttpClient;
        this.exchangeWireMapper = exchangeWireMapper;
        this.clock = clock;
    }

    @Retry(name = "exchangeRead")
    public List<MarketSnapshot> listMarkets(String status, String seriesTicker, int limit) {
        List<MarketSnapshot> markets = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> params = new HashMap<>();
            params.put("status", status);
            params.put("series_ticker", seriesTicker);
            params.put("limit", Math.min(limit, MAX_PAGE_SIZE));
            params.put("cursor", cursor);

            JsonNode page = exchangeHttpClient.get("/markets", params);
            markets.addAll(exchangeWireMapper.toMarkets(page));
            String next = page.path("cursor").asText("");
            cursor = next.isBlank() ? null : next;
        } while (cursor != null && markets.size() < limit);

        log.debug("Fetched {} markets (status={}, series={})", markets.size(), status, seriesTicker);
        return markets.size() > limit ? new ArrayList<>(markets.subList(0, limit)) : markets;
    }

    @Retry(name = "exchangeRead")
    public MarketSnapshot getMarket(String ticker) {
        return exchangeWireMapper.toMarket(exchangeHttpClient.get("/markets/" + ticker, Map.of()));
    }

    @Retry(name = "exchangeRead")
    public OrderBook getOrderbook(String ticker) {
        return exchangeWireMapper.toOrderBook(ticker, exchangeHttpClient.get("/markets/" + ticker + "/orderbook", Map.of()));
    }

    @Retry(name = "exchangeRead")
    public List<ExchangeOrder> getOpenOrders() {
        return exchangeWireMapper.toOrders(exchangeHttpClient.get("/portfolio/orders", Map.of("status", "resting")));
    }

    @Retry(name = "exchangeRead")
    public List<ExchangePosition> getPositions() {
        return exchangeWireMapper.toPositions(exchangeHttpClient.get("/portfolio/positions", Map.of()));
    }

    @Retry(name = "exchangeRead")
    public AccountBalance getBalance() {
        return exchangeWireMapper.toBalance(
                exchangeHttpClient.get("/portfolio/balance", Map.of()), LocalDateTime.now(clock));
    }
}
