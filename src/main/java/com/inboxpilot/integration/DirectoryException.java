package com.inboxpilot.integration;

public class DirectoryException extends IntegrationException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
