package com.tradescheduler.backend.exception;

public class TradingApiException extends RuntimeException {
    private final int statusCode;

    public TradingApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public TradingApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TradingApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
