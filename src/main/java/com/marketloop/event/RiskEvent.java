package com.marketloop.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the risk gate and the daily loss breaker.
 *
 * <p>{@link com.marketloop.observability.LoopMetrics} counts rejections and breaker trips.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details, e.g. {@code {"market": "KXBTC-..", "reason": "..."}} for
     * TRADE_REJECTED or {@code {"dailyPnl": -160, "limit": -150}} for a breach.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
