package com.inboxpilot.dispatch.api;

import com.inboxpilot.core.events.EventBus;
import com.inboxpilot.core.events.InboxEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams one conversation's {@link InboxEvent}s to a server-sent events client.
 * <p>
 * The stream completes after {@code conversation.archived}; a suspended conversation keeps its
 * stream open until the emitter times out, so a reviewer UI sees the resume as it happens.
 */
@Service
public class ConversationEventStream {

    private static final Logger log = LoggerFactory.getLogger(ConversationEventStream.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Set<Stream> open = ConcurrentHashMap.newKeySet();

    @Autowired
    public ConversationEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    ConversationEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter open(String conversationId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var stream = new Stream(conversationId, emitter);
        stream.subscription = eventBus.subscribe(conversationId, event -> forward(stream, event));
        open.add(stream);
        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(e -> close(stream));
        log.info("Event stream opened for conversation {}", conversationId);
        return emitter;
    }

    int openStreams() {
        return open.size();
    }

    private void forward(Stream stream, InboxEvent event) {
        var data = new LinkedHashMap<String, Object>();
        data.put("conversation_id", event.conversationId());
        if (event.stage() != null) {
            data.put("stage", event.stage());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
            if (event.isFinal()) {
                close(stream);
                stream.emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} for conversation {}: {}", event.eventType(), stream.conversationId, e.getMessage());
            close(stream);
            stream.emitter.completeWithError(e);
        }
    }

    private void close(Stream stream) {
        if (open.remove(stream)) {
            stream.subscription.unsubscribe();
            log.debug("Event stream closed for conversation {}", stream.conversationId);
        }
    }

    private static final class Stream {
        private final String conversationId;
        private final SseEmitter emitter;
        private EventBus.Subscription subscription;

        private Stream(String conversationId, SseEmitter emitter) {
            this.conversationId = conversationId;
            this.emitter = emitter;
        }
    }
}
