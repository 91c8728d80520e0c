package com.inboxpilot.core.engine;

/**
 * A conversation with the requested id has already been started.
 */
public class DuplicateConversationException extends IllegalStateException {

    public DuplicateConversationException(String conversationId) {
        super("Conversation " + conversationId + " already exists");
    }
}
