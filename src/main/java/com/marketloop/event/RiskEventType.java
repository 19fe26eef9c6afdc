package com.marketloop.event;

public enum RiskEventType {

    /** The risk gate rejected a candidate. */
    TRADE_REJECTED,

    /** Less than a quarter of the daily loss allowance remains. */
    DAILY_LOSS_LIMIT_APPROACH,

    /** Daily realized loss reached the limit; the breaker is latched until the next UTC day. */
    DAILY_LOSS_LIMIT_BREACH,

    /** The breaker latch was cleared through the control API. */
    DAILY_LOSS_BREAKER_RESET,

    /** An open position moved against us by more than the alert threshold. */
    ADVERSE_MOVE_ALERT
}
