package com.inboxpilot.core.persistence;

import java.util.Optional;

/**
 * Durable record of side effects keyed by {@code conversationId:epoch:stage}.
 * <p>
 * A stage reserves its key before performing the effect and completes it afterwards.
 * A key can be reserved only once, which gives at-most-once execution across resumes
 * and process restarts.
 */
public interface SideEffectLedger {

    enum State { RESERVED, COMPLETED }

    record Entry(String key, State state, String result) {}

    Optional<Entry> find(String key);

    /** @return true when this call took the reservation, false when the key already existed */
    boolean reserve(String key);

    void complete(String key, String result);

    /** Drops a reservation whose effect failed, allowing a later retry. */
    void release(String key);
}
