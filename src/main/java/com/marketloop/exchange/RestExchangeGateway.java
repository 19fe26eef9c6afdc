package com.marketloop.exchange;

import com.marketloop.domain.model.AccountBalance;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.ExchangePosition;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.OrderAck;
import com.marketloop.domain.model.OrderBook;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * REST implementation of {@link ExchangeGateway}.
 *
 * <p>Delegates to {@link ExchangeMarketDataService} for reads, which carry the
 * Resilience4j retry, and to {@link ExchangeOrderService} for writes, which do not.
 */
@Component
public class RestExchangeGateway implements ExchangeGateway {

    private final ExchangeMarketDataService exchangeMarketDataService;
    private final ExchangeOrderService exchangeOrderService;

    public RestExchangeGateway(
            ExchangeMarketDataService exchangeMarketDataService, ExchangeOrderService exchangeOrderService) {
        this.exchangeMarketDataService = exchangeMarketDataService;
        this.exchangeOrderService = exchangeOrderService;
    }

    @Override
    public List<MarketSnapshot> listMarkets(String status, String seriesTicker, int limit) {
        return exchangeMarketDataService.listMarkets(status, seriesTicker, limit);
    }

    @Override
    public MarketSnapshot quote(String marketId) {
        return exchangeMarketDataService.getMarket(marketId);
    }

    @Override
    public OrderBook orderbook(String marketId) {
        return exchangeMarketDataService.getOrderbook(marketId);
    }

    @Override
    public OrderAck placeOrder(OrderRequest request) {
        return exchangeOrderService.placeOrder(request);
    }

    @Override
    public void cancelOrder(String orderId) {
        exchangeOrderService.cancelOrder(orderId);
    }

    @Override
    public List<ExchangeOrder> openOrders() {
        return exchangeMarketDataService.getOpenOrders();
    }

    @Override
    public List<ExchangePosition> positions() {
        return exchangeMarketDataService.getPositions();
    }

    @Override
    public AccountBalance balance() {
        return exchangeMarketDataService.getBalance();
    }
}
