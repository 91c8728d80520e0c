package com.inboxpilot.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local snapshot store. Snapshots are immutable records, so storing the
 * reference is enough. Not durable across restarts.
 */
public class InMemoryConversationSnapshotStore implements ConversationSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationSnapshotStore.class);

    private final ConcurrentHashMap<String, ConversationSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(ConversationSnapshot snapshot) {
        snapshots.put(snapshot.conversationId(), snapshot);
        log.debug("Saved snapshot for {} (epoch {}, status {})",
                snapshot.conversationId(), snapshot.epoch(), snapshot.status());
    }

    @Override
    public Optional<ConversationSnapshot> load(String conversationId) {
        return Optional.ofNullable(snapshots.get(conversationId));
    }

    @Override
    public List<ConversationSnapshot> findAwaiting() {
        return snapshots.values().stream()
                .filter(ConversationSnapshot::isAwaitingInput)
                .sorted(Comparator.comparing(ConversationSnapshot::conversationId))
                .toList();
    }

    @Override
    public void archive(String conversationId, Instant at) {
        snapshots.computeIfPresent(conversationId, (id, snapshot) -> snapshot.archive(at));
    }
}
