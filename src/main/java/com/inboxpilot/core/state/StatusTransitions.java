package com.inboxpilot.core.state;

import com.inboxpilot.core.model.ConversationStatus;

import java.util.Map;

/**
 * Checks a partial update against the {@link ConversationStatus} machine before it is merged.
 * The STATUS reducer is a plain overwrite; every writer of STATUS goes through here instead.
 */
public final class StatusTransitions {

    private StatusTransitions() {}

    /**
     * @param origin node or component producing the update, for the error message
     * @throws IllegalStateException when the update moves STATUS along an edge the machine does not have
     */
    public static void check(String origin, ConversationState state, Map<String, Object> update) {
        Object value = update.get(ConversationState.STATUS);
        if (value == null) {
            return;
        }
        ConversationStatus current = state.status();
        ConversationStatus next = (ConversationStatus) value;
        Object epoch = update.get(ConversationState.EPOCH);
        boolean newEpoch = epoch instanceof Integer && (Integer) epoch > state.epoch();
        boolean allowed = newEpoch ? current.canResetTo(next) : current.canTransitionTo(next);
        if (!allowed) {
            throw new IllegalStateException(origin + " cannot move the conversation from "
                    + current + " to " + next + (newEpoch ? " in a new epoch" : ""));
        }
    }
}
