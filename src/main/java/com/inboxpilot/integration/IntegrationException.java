package com.inboxpilot.integration;

/**
 * Failure reported by an external collaborator. Stage workers convert it into an
 * {@code EXTERNAL_SERVICE} error entry instead of letting it reach the scheduler.
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
