package com.inboxpilot.integration;

import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.MeetingRequest;

/**
 * Natural-language interpretation of message content.
 */
public interface MessageInterpreter {

    ExtractedContext extractContext(InboundEmail email) throws InterpretationException;

    /**
     * Reads meeting requirements from the request. {@code instructions} carries the stage task,
     * which after feedback holds the reviewer's scheduling instruction and takes precedence.
     */
    MeetingRequest extractMeetingRequirements(InboundEmail email, ExtractedContext context, String instructions)
            throws InterpretationException;

    String composeReply(ComposeContext context) throws InterpretationException;
}
