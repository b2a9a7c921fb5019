package com.tradescheduler.backend.exception;

public class TradingApiRateLimitException extends TradingApiException {
    public TradingApiRateLimitException(String message) {
        super(message, 429, null);
    }

    public TradingApiRateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
