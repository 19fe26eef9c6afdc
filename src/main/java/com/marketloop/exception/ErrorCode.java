package com.marketloop.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE("INVALID_STATE", 409),
    GUARDRAIL_VIOLATION("GUARDRAIL_VIOLATION", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502),
    EXCHANGE_UNAVAILABLE("EXCHANGE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
