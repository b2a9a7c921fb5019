package com.tradescheduler.backend.exception;

public class TradingApiTimeoutException extends TradingApiException {
    public TradingApiTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
