package com.marketloop.exception;

/**
 * Transient exchange failure: rate limiting (429), a 5xx response, a timeout or
 * an I/O error. Read-side calls are retried on this type only.
 */
public class ExchangeUnavailableException extends ExchangeException {

    public ExchangeUnavailableException(String message, int statusCode) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message, statusCode, null);
    }

    public ExchangeUnavailableException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message, 0, cause);
    }
}
