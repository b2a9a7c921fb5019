package com.tradescheduler.backend.exception;

public class TradingApiCircuitOpenException extends TradingApiException {
    public TradingApiCircuitOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
