package com.marketloop.exchange;

import com.marketloop.domain.model.AccountBalance;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.ExchangePosition;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.OrderAck;
import com.marketloop.domain.model.OrderBook;
import java.util.List;

/**
 * The loop's only view of the exchange. Scanners use the read methods; order
 * submission and cancellation are reserved for the execution engine and shutdown.
 *
 * <p>Failures surface as {@link com.marketloop.exception.ExchangeException}, or
 * {@link com.marketloop.exception.ExchangeUnavailableException} when transient.
 */
public interface ExchangeGateway {

    // ---- Market data ----

    /**
     * Lists markets, following pagination until {@code limit} markets are collected.
     *
     * @param status       market status filter, e.g. "open"
     * @param seriesTicker optional series filter, null for all
     * @param limit        maximum number of markets returned
     */
    List<MarketSnapshot> listMarkets(String status, String seriesTicker, int limit);

    MarketSnapshot quote(String marketId);

    OrderBook orderbook(String marketId);

    // ---- Orders ----

    /** Submits once. Never retried. */
    OrderAck placeOrder(OrderRequest request);

    /** Cancels once. Never retried. */
    void cancelOrder(String orderId);

    List<ExchangeOrder> openOrders();

    // ---- Portfolio ----

    List<ExchangePosition> positions();

    AccountBalance balance();
}
