package com.inboxpilot.integration;

public class CalendarException extends IntegrationException {

    public CalendarException(String message) {
        super(message);
    }

    public CalendarException(String message, Throwable cause) {
        super(message, cause);
    }
}
