package com.marketloop.domain.enums;

public enum ParamType {
    INT,
    DECIMAL,
    BOOLEAN,
    TEXT
}
