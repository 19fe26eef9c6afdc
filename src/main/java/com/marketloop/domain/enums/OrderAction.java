package com.marketloop.domain.enums;

public enum OrderAction {
    BUY,
    SELL
}
