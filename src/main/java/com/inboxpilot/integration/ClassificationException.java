package com.inboxpilot.integration;

public class ClassificationException extends IntegrationException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
