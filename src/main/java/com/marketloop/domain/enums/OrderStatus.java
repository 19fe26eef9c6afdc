package com.marketloop.domain.enums;

/** Exchange-reported order state. */
public enum OrderStatus {
    PENDING,
    RESTING,
    EXECUTED,
    CANCELED,
    REJECTED,
    UNKNOWN;

    /** An accepted order is committed capital: filled, resting on the book, or about to be. */
    public boolean isAccepted() {
        return this == EXECUTED || this == RESTING || this == PENDING;
    }

    public static OrderStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase();
        if (normalized.equals("CANCELLED")) {
            return CANCELED;
        }
        for (OrderStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
