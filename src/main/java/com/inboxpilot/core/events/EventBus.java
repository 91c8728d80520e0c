package com.inboxpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for conversation events.
 * <p>
 * Supports per-conversation subscriptions and global subscriptions. A failing subscriber
 * is logged and never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<InboxEvent>>> conversationSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<InboxEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(InboxEvent event) {
        log.debug("Publishing event: {} for conversation {}", event.eventType(), event.conversationId());

        List<Consumer<InboxEvent>> subs = conversationSubscribers.get(event.conversationId());
        if (subs != null) {
            for (Consumer<InboxEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<InboxEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String conversationId, Consumer<InboxEvent> consumer) {
        conversationSubscribers.computeIfAbsent(conversationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            var subs = conversationSubscribers.get(conversationId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    conversationSubscribers.remove(conversationId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<InboxEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<InboxEvent> subscriber, InboxEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
