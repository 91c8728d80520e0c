package com.inboxpilot.core.nodes;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.interrupt.ActionRequests;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.state.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Suspends a failed conversation until a human acknowledges the error.
 * <p>
 * Reached when a stage leaves the conversation in ERROR, or when compose produced no draft.
 * The status stays ERROR while the interrupt is pending.
 */
@Component
public class ErrorReviewNode {

    private static final Logger log = LoggerFactory.getLogger(ErrorReviewNode.class);

    static final String STAGE = "error_review";

    private final InterruptController interruptController;
    private final InboxProperties properties;

    public ErrorReviewNode(InterruptController interruptController, InboxProperties properties) {
        this.interruptController = interruptController;
        this.properties = properties;
    }

    public Map<String, Object> apply(ConversationState state) {
        var update = new HashMap<String, Object>();
        StageError failure;
        if (state.status() == ConversationStatus.ERROR && !state.errors().isEmpty()) {
            failure = state.errors().get(state.errors().size() - 1);
        } else {
            failure = StageError.of(StageKind.COMPOSE, ErrorKind.VALIDATION, "No draft was produced");
            update.put(ConversationState.ERRORS, List.of(failure));
        }
        log.warn("Conversation {} failed at {} [{}]: {}; awaiting acknowledgment",
                state.conversationId(), failure.stage(), failure.kind(), failure.message());

        var request = ActionRequests.errorReview(state.request().orElse(null), failure, state.draftOutput(),
                properties.getInterrupt().getReviewTimeout());
        update.put(ConversationState.PENDING_INTERRUPT,
                interruptController.raise(InterruptPoint.ERROR_REVIEW, request, state.epoch()));
        update.put(ConversationState.STATUS, ConversationStatus.ERROR);
        update.put(ConversationState.MESSAGES, List.of(STAGE + ": awaiting acknowledgment of the "
                + failure.stage() + " failure"));
        return update;
    }
}
