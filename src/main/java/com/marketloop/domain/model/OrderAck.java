package com.marketloop.domain.model;

import com.marketloop.domain.enums.OrderStatus;
import lombok.Value;

/** Exchange acknowledgement of a submitted order. */
@Value
public class OrderAck {

    String orderId;
    OrderStatus status;

    public boolean isAccepted() {
        return orderId != null && status.isAccepted();
    }
}
