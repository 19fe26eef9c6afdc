package com.marketloop.exception;

import java.util.Map;

/** Raised when a value for a tunable setting falls outside its guardrail bounds. */
public class GuardrailViolationException extends BaseException {

    public GuardrailViolationException(String key, String value, String message) {
        super(ErrorCode.GUARDRAIL_VIOLATION, message, Map.of("key", key, "value", String.valueOf(value)));
    }
}
