package com.tradescheduler.backend.exception;

public class TradingApiServerException extends TradingApiException {
    public TradingApiServerException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
