package com.marketloop.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeHttpClient;
import com.marketloop.exchange.ExchangeMarketDataService;
import com.marketloop.exchange.mapper.ExchangeWireMapper;
import com.marketloop.support.MutableClock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExchangeMarketDataServiceTest {

    @Mock
    private ExchangeHttpClient exchangeHttpClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExchangeMarketDataService marketDataService;

    @BeforeEach
    void setUp() {
        marketDataService = new ExchangeMarketDataService(
                exchangeHttpClient, new ExchangeWireMapper(), MutableClock.at("2026-03-10T12:00:00Z"));
    }

    @Test
    @DisplayName("Follows the cursor until the last page")
    void followsCursor() throws Exception {
        when(exchangeHttpClient.get(eq("/markets"), argThat(params -> params != null && params.get("cursor") == null)))
                .thenReturn(objectMapper.readTree("{\"markets\":[{\"ticker\":\"A\"},{\"ticker\":\"B\"}],\"cursor\":\"c2\"}"));
        when(exchangeHttpClient.get(eq("/markets"), argThat(params -> params != null && "c2".equals(params.get("cursor")))))
                .thenReturn(objectMapper.readTree("{\"markets\":[{\"ticker\":\"C\"}],\"cursor\":\"\"}"));

        List<MarketSnapshot> markets = marketDataService.listMarkets("open", null, 200);

        assertThat(markets).extracting(MarketSnapshot::getTicker).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Stops paging once the limit is reached and trims the excess")
    void respectsLimit() throws Exception {
        when(exchangeHttpClient.get(eq("/markets"), anyMap()))
                .thenReturn(objectMapper.readTree("{\"markets\":[{\"ticker\":\"A\"},{\"ticker\":\"B\"},{\"ticker\":\"C\"}],"
                        + "\"cursor\":\"more\"}"));

        List<MarketSnapshot> markets = marketDataService.listMarkets("open", null, 2);

        assertThat(markets).hasSize(2);
        verify(exchangeHttpClient, times(1)).get(eq("/markets"), anyMap());
    }

    @Test
    @DisplayName("Balance is stamped with the fetch time")
    void balance() throws Exception {
        when(exchangeHttpClient.get(eq("/portfolio/balance"), anyMap()))
                .thenReturn(objectMapper.readTree("{\"balance\":123456}"));

        assertThat(marketDataService.getBalance().getAvailable()).isEqualByComparingTo("1234.56");
    }
}
