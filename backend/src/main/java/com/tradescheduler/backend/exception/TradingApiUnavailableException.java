package com.tradescheduler.backend.exception;

public class TradingApiUnavailableException extends TradingApiException {
    public TradingApiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
