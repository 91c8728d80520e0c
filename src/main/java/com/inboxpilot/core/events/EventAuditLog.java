package com.inboxpilot.core.events;

import com.inboxpilot.core.metrics.InboxMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Global subscriber that writes every conversation event to the audit log and counts it
 * under {@code inbox.events}.
 */
@Component
public class EventAuditLog {

    private static final Logger log = LoggerFactory.getLogger("com.inboxpilot.audit");

    private final EventBus eventBus;
    private final InboxMetrics metrics;
    private EventBus.Subscription subscription;

    public EventAuditLog(EventBus eventBus, InboxMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @PostConstruct
    void subscribe() {
        subscription = eventBus.subscribeAll(this::record);
    }

    @PreDestroy
    void unsubscribe() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void record(InboxEvent event) {
        metrics.recordEvent(event.eventType());
        try (var ignored = MDC.putCloseable("conversationId", event.conversationId())) {
            if (event.stage() == null) {
                log.info("{} {}", event.eventType(), event.payload());
            } else {
                log.info("{} [{}] {}", event.eventType(), event.stage(), event.payload());
            }
        }
    }
}
