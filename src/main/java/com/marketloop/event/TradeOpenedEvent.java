package com.marketloop.event;

import com.marketloop.domain.model.TradeRecord;
import org.springframework.context.ApplicationEvent;

/** Published after an entry is committed to the ledger. */
public class TradeOpenedEvent extends ApplicationEvent {

    private final TradeRecord trade;

    public TradeOpenedEvent(Object source, TradeRecord trade) {
        super(source);
        this.trade = trade;
    }

    public TradeRecord getTrade() {
        return trade;
    }
}
