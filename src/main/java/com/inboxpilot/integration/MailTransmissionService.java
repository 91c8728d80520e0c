package com.inboxpilot.integration;

public interface MailTransmissionService {

    /**
     * Sends a message in the given thread.
     *
     * @return provider message id
     */
    String send(String to, String subject, String body, String threadId) throws MailTransmissionException;
}
