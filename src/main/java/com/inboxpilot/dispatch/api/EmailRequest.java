package com.inboxpilot.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxpilot.core.model.InboundEmail;

import java.time.Instant;

/**
 * Inbound JSON body for POST /api/v1/conversations.
 *
 * @param messageId  provider message id; nullable
 * @param threadId   provider thread id used for the reply; nullable
 * @param sender     address the reply goes to
 * @param subject    original subject
 * @param body       plain-text body
 * @param receivedAt arrival time; nullable, defaults to now
 */
public record EmailRequest(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("thread_id") String threadId,
        String sender,
        String subject,
        String body,
        @JsonProperty("received_at") Instant receivedAt
) {

    public InboundEmail toEmail(Instant now) {
        return new InboundEmail(messageId, threadId, sender, subject, body, receivedAt != null ? receivedAt : now);
    }
}
