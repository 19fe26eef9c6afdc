package com.marketloop.event;

import com.marketloop.domain.model.TradeRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a trade is finalized and its position removed. The reflection queue
 * and the loss-trigger recommender listen for it.
 */
public class TradeClosedEvent extends ApplicationEvent {

    private final TradeRecord trade;

    public TradeClosedEvent(Object source, TradeRecord trade) {
        super(source);
        this.trade = trade;
    }

    public TradeRecord getTrade() {
        return trade;
    }
}
