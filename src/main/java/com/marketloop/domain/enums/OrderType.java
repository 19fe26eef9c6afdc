package com.marketloop.domain.enums;

public enum OrderType {
    LIMIT,
    MARKET
}
