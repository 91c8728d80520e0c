package com.inboxpilot.core.nodes;

import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.state.ConversationState;

/**
 * A stage the router can dispatch to. Implementations read their own domain fields and
 * describe the result; they never mutate state and never throw to the scheduler.
 */
public interface StageWorker {

    StageKind kind();

    StageOutcome execute(ConversationState state);
}
