package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The inbound message that starts a conversation. Never modified once stored.
 *
 * @param messageId  provider message id
 * @param threadId   provider thread id, reused when replying
 * @param sender     address of the original sender (the reply recipient)
 * @param subject    original subject line
 * @param body       plain-text body
 * @param receivedAt when the message arrived
 */
public record InboundEmail(
        String messageId,
        String threadId,
        String sender,
        String subject,
        String body,
        Instant receivedAt
) implements Serializable {

    public boolean hasSender() {
        return sender != null && !sender.isBlank();
    }

    public boolean hasContent() {
        return (subject != null && !subject.isBlank()) || (body != null && !body.isBlank());
    }

    public String replySubject() {
        String base = subject == null ? "" : subject.trim();
        if (base.regionMatches(true, 0, "Re:", 0, 3)) {
            return base;
        }
        return "Re: " + base;
    }
}
