package com.marketloop.exchange.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.enums.OrderAction;
import com.marketloop.domain.enums.OrderStatus;
import com.marketloop.domain.enums.Side;
import com.marketloop.domain.model.AccountBalance;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.ExchangePosition;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.OrderAck;
import com.marketloop.domain.model.OrderBook;
import com.marketloop.exchange.OrderRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps between the exchange's JSON payloads and domain types.
 *
 * <p>The exchange quotes every price in integer cents of the YES side. Domain prices
 * are fractions in [0,1]; this is the only place the two scales meet.
 */
@Component
public class ExchangeWireMapper {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public MarketSnapshot toMarket(JsonNode node) {
        JsonNode market = node.has("market") ? node.get("market") : node;
        String closeTime = text(market, "close_time");
        if (closeTime == null) {
            closeTime = text(market, "expiration_time");
        }
        return MarketSnapshot.builder()
                .ticker(text(market, "ticker"))
                .title(text(market, "title"))
                .category(text(market, "category"))
                .status(text(market, "status"))
                .result(text(market, "result"))
                .yesBid(centsToFraction(market.get("yes_bid")))
                .yesAsk(centsToFraction(market.get("yes_ask")))
                .noBid(centsToFraction(market.get("no_bid")))
                .noAsk(centsToFraction(market.get("no_ask")))
                .lastPrice(centsToFraction(market.get("last_price")))
                .volume(decimal(market.get("volume")))
                .closeTime(parseTimestamp(closeTime))
                .build();
    }

    public List<MarketSnapshot> toMarkets(JsonNode page) {
        List<MarketSnapshot> markets = new ArrayList<>();
        JsonNode array = page.path("markets");
        if (array.isArray()) {
            array.forEach(node -> markets.add(toMarket(node)));
        }
        return markets;
    }

    public OrderBook toOrderBook(String ticker, JsonNode node) {
        JsonNode book = node.has("orderbook") ? node.get("orderbook") : node;
        return new OrderBook(ticker, levels(book.get("yes")), levels(book.get("no")));
    }

    /**
     * Request body for an order. The exchange takes a YES-denominated limit price, so a
     * NO order at 30 cents is sent as {@code yes_price = 70}.
     */
    public Map<String, Object> toOrderBody(OrderRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ticker", request.getMarketId());
        body.put("action", request.getAction().name().toLowerCase());
        body.put("side", request.getSide().wireValue());
        body.put("count", request.getCount());
        body.put("type", request.getType().name().toLowerCase());
        body.put("yes_price", toYesPriceCents(request.getSide(), request.getPriceCents()));
        if (request.getClientOrderId() != null) {
            body.put("client_order_id", request.getClientOrderId());
        }
        return body;
    }

    public int toYesPriceCents(Side side, int priceCents) {
        return side == Side.YES ? priceCents : 100 - priceCents;
    }

    public OrderAck toOrderAck(JsonNode node) {
        JsonNode order = node.has("order") ? node.get("order") : node;
        return new OrderAck(text(order, "order_id"), OrderStatus.fromWire(text(order, "status")));
    }

    public List<ExchangeOrder> toOrders(JsonNode node) {
        List<ExchangeOrder> orders = new ArrayList<>();
        JsonNode array = node.path("orders");
        if (!array.isArray()) {
            return orders;
        }
        for (JsonNode order : array) {
            String sideText = text(order, "side");
            Side side = sideText != null ? Side.fromWire(sideText) : Side.YES;
            String actionText = text(order, "action");
            int yesPrice = order.path("yes_price").asInt(0);
            orders.add(ExchangeOrder.builder()
                    .orderId(text(order, "order_id"))
                    .marketId(text(order, "ticker"))
                    .side(side)
                    .action(actionText != null ? OrderAction.valueOf(actionText.toUpperCase()) : OrderAction.BUY)
                    .status(OrderStatus.fromWire(text(order, "status")))
                    .priceCents(toYesPriceCents(side, yesPrice))
                    .remainingCount(order.path("remaining_count").asInt(0))
                    .build());
        }
        return orders;
    }

    public List<ExchangePosition> toPositions(JsonNode node) {
        List<ExchangePosition> positions = new ArrayList<>();
        JsonNode array = node.path("market_positions");
        if (!array.isArray()) {
            return positions;
        }
        for (JsonNode position : array) {
            positions.add(ExchangePosition.builder()
                    .marketId(text(position, "ticker"))
                    .contracts(position.path("position").asInt(0))
                    .marketExposure(centsToDollars(position.get("market_exposure")))
                    .realizedPnl(centsToDollars(position.get("realized_pnl")))
                    .build());
        }
        return positions;
    }

    public AccountBalance toBalance(JsonNode node, LocalDateTime fetchedAt) {
        return new AccountBalance(centsToDollars(node.get("balance")), fetchedAt);
    }

    /** Parses an ISO-8601 timestamp into UTC local time; null when absent or malformed. */
    public LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    BigDecimal centsToFraction(JsonNode node) {
        if (node == null || node.isNull() || !node.isNumber() && !node.isTextual()) {
            return null;
        }
        BigDecimal cents = decimal(node);
        return cents != null ? cents.divide(HUNDRED, 4, RoundingMode.HALF_UP) : null;
    }

    private BigDecimal centsToDollars(JsonNode node) {
        BigDecimal cents = decimal(node);
        return cents != null ? cents.divide(HUNDRED, 2, RoundingMode.HALF_UP) : BigDecimal.ZERO;
    }

    private List<OrderBook.Level> levels(JsonNode array) {
        List<OrderBook.Level> levels = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return levels;
        }
        for (JsonNode level : array) {
            if (level.isArray() && level.size() >= 1) {
                levels.add(new OrderBook.Level(level.get(0).asInt(), level.size() > 1 ? level.get(1).asInt() : 0));
            } else if (level.isObject() && level.has("price")) {
                levels.add(new OrderBook.Level(level.get("price").asInt(), level.path("quantity").asInt(0)));
            }
        }
        return levels;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
