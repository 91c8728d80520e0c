package com.inboxpilot.integration.local;

import com.inboxpilot.integration.MailTransmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mail "transport" that only logs and records outgoing messages.
 */
public class RecordingMailTransmissionService implements MailTransmissionService {

    private static final Logger log = LoggerFactory.getLogger(RecordingMailTransmissionService.class);

    public record SentMail(String messageId, String to, String subject, String body, String threadId) {}

    private final CopyOnWriteArrayList<SentMail> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String send(String to, String subject, String body, String threadId) {
        String messageId = "msg-" + counter.incrementAndGet();
        sent.add(new SentMail(messageId, to, subject, body, threadId));
        log.info("Recorded outgoing mail {} to {} in thread {}: {}", messageId, to, threadId, subject);
        return messageId;
    }

    public List<SentMail> sent() {
        return List.copyOf(sent);
    }
}
