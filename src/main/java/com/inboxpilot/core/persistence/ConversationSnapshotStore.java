package com.inboxpilot.core.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for conversation snapshots, keyed by conversation id.
 * A save replaces the previous snapshot of the same conversation.
 */
public interface ConversationSnapshotStore {

    void save(ConversationSnapshot snapshot);

    Optional<ConversationSnapshot> load(String conversationId);

    /** Snapshots suspended at an interrupt and not archived. */
    List<ConversationSnapshot> findAwaiting();

    /** Marks the conversation archived. No-op when it does not exist. */
    void archive(String conversationId, Instant at);
}
