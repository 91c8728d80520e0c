package com.inboxpilot.core.state;

import org.bsc.langgraph4j.state.Reducer;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Applies partial updates to a conversation state map using the per-field reducers
 * declared in {@link ConversationState#FIELDS}.
 * <p>
 * Because every reducer is associative, {@code apply(apply(s, u1), u2)} equals
 * {@code apply(s, combine(u1, u2))}. Keys without a declared field are overwritten.
 */
@Component
public class ConversationStore {

    public Map<String, Object> apply(Map<String, Object> state, Map<String, Object> update) {
        var result = new HashMap<String, Object>(state);
        update.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            Object current = state.containsKey(key) ? state.get(key) : defaultValue(key);
            result.put(key, merge(key, current, value));
        });
        return result;
    }

    public Map<String, Object> combine(Map<String, Object> first, Map<String, Object> second) {
        var result = new HashMap<String, Object>(first);
        second.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            result.put(key, first.containsKey(key) ? merge(key, first.get(key), value) : value);
        });
        return result;
    }

    /** State map holding every field's default, the identity for {@link #apply}. */
    public Map<String, Object> initial() {
        var result = new HashMap<String, Object>();
        ConversationState.FIELDS.forEach((key, field) -> {
            Object value = defaultValue(key);
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object merge(String key, Object current, Object update) {
        var field = (ConversationState.Field<Object>) ConversationState.FIELDS.get(key);
        if (field == null) {
            return update;
        }
        Reducer<Object> reducer = field.reducer();
        return reducer.apply(current, update);
    }

    private Object defaultValue(String key) {
        var field = ConversationState.FIELDS.get(key);
        if (field == null || field.defaultValue() == null) {
            return null;
        }
        return field.defaultValue().get();
    }
}
