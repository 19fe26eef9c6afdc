package com.marketloop.exception;

/**
 * A non-retryable failure reported by the exchange: a 4xx response other than 429,
 * or a response body the adapter cannot interpret.
 */
public class ExchangeException extends BaseException {

    private final int statusCode;

    public ExchangeException(String message) {
        this(ErrorCode.EXCHANGE_ERROR, message, 0, null);
    }

    public ExchangeException(String message, int statusCode) {
        this(ErrorCode.EXCHANGE_ERROR, message, statusCode, null);
    }

    public ExchangeException(String message, Throwable cause) {
        this(ErrorCode.EXCHANGE_ERROR, message, 0, cause);
    }

    protected ExchangeException(ErrorCode errorCode, String message, int statusCode, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
