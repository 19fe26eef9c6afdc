package com.marketloop.exchange;

import com.marketloop.domain.model.OrderAck;
import com.marketloop.exception.ExchangeException;
import com.marketloop.exchange.mapper.ExchangeWireMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order submission and cancellation. Internal to {@link RestExchangeGateway}.
 *
 * <p>No retry here: a timed-out submission may already be on the book.
 */
@Service
public class ExchangeOrderService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeOrderService.class);

    private final ExchangeHttpClient exchangeHttpClient;
    private final ExchangeWireMapper exchangeWireMapper;

    public ExchangeOrderService(ExchangeHttpClient exchangeHttpClient, ExchangeWireMapper exchangeWireMapper) {
        this.exchangeHttpClient = exchangeHttpClient;
        this.exchangeWireMapper = exchangeWireMapper;
    }

    public OrderAck placeOrder(OrderRequest request) {
        if (request.getCount() <= 0) {
            throw new ExchangeException("Order count must be positive: " + request.getCount());
        }
        if (request.getPriceCents() < 1 || request.getPriceCents() > 99) {
            throw new ExchangeException("Order price out of range: " + request.getPriceCents() + "c");
        }
        OrderAck ack = exchangeWireMapper.toOrderAck(
                exchangeHttpClient.post("/portfolio/orders", exchangeWireMapper.toOrderBody(request)));
        log.info(
                "Order placed: orderId={} market={} side={} action={} count={} price={}c status={}",
                ack.getOrderId(),
                request.getMarketId(),
                request.getSide(),
                request.getAction(),
                request.getCount(),
                request.getPriceCents(),
                ack.getStatus());
        return ack;
    }

    public void cancelOrder(String orderId) {
        exchangeHttpClient.delete("/portfolio/orders/" + orderId);
        log.info("Order cancelled: orderId={}", orderId);
    }
}
