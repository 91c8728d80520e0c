package com.inboxpilot.integration;

/**
 * Fatal start-up failure. Raised before any conversation state exists.
 */
public class BootstrapException extends RuntimeException {

    public BootstrapException(String message) {
        super(message);
    }
}
