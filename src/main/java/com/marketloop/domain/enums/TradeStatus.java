package com.marketloop.domain.enums;

public enum TradeStatus {
    OPEN,
    CLOSED,
    CANCELLED
}
