package com.marketloop.domain.enums;

/**
 * Lifecycle of a parameter-change proposal. PENDING is the only non-terminal state.
 * The control API moves it to APPROVED or DENIED; the daily expiry task moves a
 * PENDING proposal older than {@code recommendation_expiry_days} to DENIED.
 */
public enum RecommendationStatus {
    PENDING,
    APPROVED,
    DENIED
}
