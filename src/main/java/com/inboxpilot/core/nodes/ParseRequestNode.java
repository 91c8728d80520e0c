package com.inboxpilot.core.nodes;

import com.inboxpilot.core.logging.MdcContext;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.InterpretationException;
import com.inboxpilot.integration.MessageInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the request and extracts its structured context.
 * <p>
 * A request without a sender or without any content is a validation error; no context is set and
 * the router will go straight to the composer.
 */
@Component
public class ParseRequestNode {

    private static final Logger log = LoggerFactory.getLogger(ParseRequestNode.class);

    static final String STAGE = "parser";

    private final MessageInterpreter interpreter;

    public ParseRequestNode(MessageInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    public Map<String, Object> apply(ConversationState state) {
        if (state.extractedContext().isPresent()) {
            return Map.of(ConversationState.MESSAGES, List.of(STAGE + ": context already extracted"));
        }
        MdcContext.setStage(STAGE);
        try {
            var update = new HashMap<String, Object>();
            InboundEmail email = state.request().orElse(null);
            var problems = new ArrayList<String>();
            if (email == null) {
                problems.add("request is missing");
            } else {
                if (!email.hasSender()) {
                    problems.add("sender is missing");
                }
                if (!email.hasContent()) {
                    problems.add("subject and body are empty");
                }
            }
            if (!problems.isEmpty()) {
                String message = "Invalid request: " + String.join(", ", problems);
                log.warn(message);
                update.put(ConversationState.ERRORS, List.of(new StageError(STAGE, ErrorKind.VALIDATION, message)));
                update.put(ConversationState.MESSAGES, List.of(STAGE + ": " + message));
                return update;
            }

            ExtractedContext context;
            try {
                context = interpreter.extractContext(email);
            } catch (InterpretationException e) {
                log.warn("Context extraction failed: {}", e.getMessage());
                update.put(ConversationState.ERRORS, List.of(new StageError(STAGE, ErrorKind.EXTERNAL_SERVICE,
                        "Context extraction failed: " + e.getMessage())));
                update.put(ConversationState.MESSAGES, List.of(STAGE + ": context extraction failed"));
                return update;
            }
            log.info("Parsed request from {}: {} action(s), urgency {}, meeting requested: {}",
                    email.sender(), context.requestedActions().size(), context.urgency(), context.meetingRequested());
            update.put(ConversationState.EXTRACTED_CONTEXT, context);
            update.put(ConversationState.INSIGHTS, context.keyEntities());
            update.put(ConversationState.MESSAGES, List.of(STAGE + ": extracted " + context.keyEntities().size()
                    + " entities, urgency " + context.urgency()));
            return update;
        } finally {
            MdcContext.clearStage();
        }
    }
}
