package com.inboxpilot.core.engine;

/**
 * A human response arrived for a conversation that is not suspended at an interrupt,
 * for example a second resume of the same interrupt.
 */
public class NotAwaitingInputException extends IllegalStateException {

    public NotAwaitingInputException(String conversationId, String status) {
        super("Conversation " + conversationId + " is not awaiting input (status " + status + ")");
    }
}
