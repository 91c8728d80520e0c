package com.inboxpilot.core.persistence;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySideEffectLedger implements SideEffectLedger {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Entry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean reserve(String key) {
        return entries.putIfAbsent(key, new Entry(key, State.RESERVED, null)) == null;
    }

    @Override
    public void complete(String key, String result) {
        entries.put(key, new Entry(key, State.COMPLETED, result));
    }

    @Override
    public void release(String key) {
        entries.computeIfPresent(key, (k, entry) -> entry.state() == State.RESERVED ? null : entry);
    }
}
