package com.marketloop.exchange;

import com.marketloop.domain.enums.OrderAction;
import com.marketloop.domain.enums.OrderType;
import com.marketloop.domain.enums.Side;
import lombok.Builder;
import lombok.Value;

/**
 * Order submission. {@code priceCents} is the price of {@code side} in whole cents;
 * the adapter converts it to the exchange's YES-denominated limit price.
 */
@Value
@Builder
public class OrderRequest {

    String marketId;
    Side side;
    OrderAction action;
    int count;
    int priceCents;
    OrderType type;
    String clientOrderId;
}
