package com.inboxpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something observable happened to a conversation.
 * <p>
 * The engine publishes {@link #STARTED} and {@link #RESUMED} when a run begins,
 * {@link #INTERRUPT_RAISED} when it suspends for a reviewer, {@link #REPLY_SENT} and
 * {@link #EVENT_BOOKED} once an external side effect is recorded in the ledger, and
 * {@link #ARCHIVED} when the conversation reaches a terminal status. No event follows
 * {@code ARCHIVED}.
 *
 * @param eventType      one of the type constants below
 * @param conversationId the conversation this event belongs to
 * @param stage          interrupt point or stage name, null for conversation-level events
 * @param payload        insertion-ordered details, such as the status or the idempotency key
 * @param timestamp      engine clock time of publication
 */
public record InboxEvent(
        String eventType,
        String conversationId,
        String stage,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static final String STARTED = "conversation.started";
    public static final String RESUMED = "conversation.resumed";
    public static final String INTERRUPT_RAISED = "interrupt.raised";
    public static final String REPLY_SENT = "reply.sent";
    public static final String EVENT_BOOKED = "event.booked";
    public static final String ARCHIVED = "conversation.archived";

    public InboxEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** True for the last event a conversation publishes. */
    public boolean isFinal() {
        return ARCHIVED.equals(eventType);
    }
}
