package com.tradescheduler.backend.exception;

public class InvalidScheduleException extends ValidationException {
    public InvalidScheduleException(String message) {
        super(message);
    }
}
