package com.inboxpilot.integration;

public class InterpretationException extends IntegrationException {

    public InterpretationException(String message) {
        super(message);
    }

    public InterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
