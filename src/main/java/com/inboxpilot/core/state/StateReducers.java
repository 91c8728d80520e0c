package com.inboxpilot.core.state;

import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Field merge strategies shared by the graph channels and {@link ConversationStore}.
 * Every reducer is associative; a field's default value is its identity element.
 */
public final class StateReducers {

    private StateReducers() {}

    /** Right-biased overwrite. */
    public static <T> Reducer<T> overwrite() {
        return (current, update) -> update != null ? update : current;
    }

    /** Keeps the first value ever written. */
    public static <T> Reducer<T> firstWins() {
        return (current, update) -> current != null ? current : update;
    }

    public static <E> Reducer<List<E>> concat() {
        return (current, update) -> {
            if (current == null || current.isEmpty()) {
                return update == null ? List.of() : List.copyOf(update);
            }
            if (update == null || update.isEmpty()) {
                return List.copyOf(current);
            }
            var merged = new ArrayList<E>(current.size() + update.size());
            merged.addAll(current);
            merged.addAll(update);
            return List.copyOf(merged);
        };
    }

    /** Append keeping first-occurrence order, dropping duplicates. */
    public static <E> Reducer<List<E>> distinctAppend() {
        return (current, update) -> {
            var merged = new LinkedHashSet<E>();
            if (current != null) {
                merged.addAll(current);
            }
            if (update != null) {
                merged.addAll(update);
            }
            return List.copyOf(merged);
        };
    }

    /** Key-wise union, right-biased on conflicting keys. */
    public static <K, V> Reducer<Map<K, V>> union() {
        return (current, update) -> {
            var merged = new HashMap<K, V>();
            if (current != null) {
                merged.putAll(current);
            }
            if (update != null) {
                merged.putAll(update);
            }
            return Map.copyOf(merged);
        };
    }

    public static Reducer<Integer> max() {
        return (current, update) -> {
            if (current == null) return update;
            if (update == null) return current;
            return Math.max(current, update);
        };
    }

    /** Key-wise union keeping the larger count. */
    public static Reducer<Map<String, Integer>> keywiseMax() {
        return (current, update) -> {
            var merged = new HashMap<String, Integer>();
            if (current != null) {
                merged.putAll(current);
            }
            if (update != null) {
                update.forEach((key, value) -> merged.merge(key, value, Math::max));
            }
            return Map.copyOf(merged);
        };
    }
}
