package com.marketloop.domain.model;

import com.marketloop.domain.enums.OrderAction;
import com.marketloop.domain.enums.OrderStatus;
import com.marketloop.domain.enums.Side;
import lombok.Builder;
import lombok.Value;

/** An order as reported by the exchange's open-orders listing. */
@Value
@Builder
public class ExchangeOrder {

    String orderId;
    String marketId;
    Side side;
    OrderAction action;
    OrderStatus status;
    int priceCents;
    int remainingCount;
}
