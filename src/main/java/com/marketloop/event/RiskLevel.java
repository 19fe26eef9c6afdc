package com.marketloop.event;

public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
