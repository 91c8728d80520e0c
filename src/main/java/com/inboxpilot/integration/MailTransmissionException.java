package com.inboxpilot.integration;

public class MailTransmissionException extends IntegrationException {

    public MailTransmissionException(String message) {
        super(message);
    }

    public MailTransmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
