package com.inboxpilot.core.nodes;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.interrupt.ActionRequests;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Suspends the conversation for human review of the draft.
 */
@Component
public class ReviewDraftNode {

    private final InterruptController interruptController;
    private final InboxProperties properties;

    public ReviewDraftNode(InterruptController interruptController, InboxProperties properties) {
        this.interruptController = interruptController;
        this.properties = properties;
    }

    public Map<String, Object> apply(ConversationState state) {
        var email = state.request().orElseThrow(() -> new IllegalStateException("Cannot review without a request"));
        var request = ActionRequests.draftReview(email, state.draftOutput(), reviewDetails(state),
                properties.getInterrupt().getReviewTimeout());
        var pending = interruptController.raise(InterruptPoint.DRAFT_REVIEW, request, state.epoch());
        return Map.of(
                ConversationState.PENDING_INTERRUPT, pending,
                ConversationState.STATUS, ConversationStatus.AWAITING_REVIEW,
                ConversationState.MESSAGES, List.of("review: awaiting human review"));
    }

    /** Plain-text summary shown to the reviewer next to the draft. */
    static String reviewDetails(ConversationState state) {
        var details = new StringBuilder();
        details.append("Epoch ").append(state.epoch());
        state.routingPlan().ifPresent(plan -> details.append("\nPlan: ")
                .append(plan.stages().stream().map(StageKind::wireName).collect(Collectors.joining(" -> ")))
                .append(plan.rationale().isBlank() ? "" : "\nRationale: " + plan.rationale()));
        for (StageKind stage : List.of(StageKind.SCHEDULING, StageKind.KNOWLEDGE, StageKind.CONTACT)) {
            state.taskResult(stage).ifPresent(result -> details.append('\n')
                    .append(stage.wireName()).append(": ").append(describe(result)));
        }
        if (!state.errors().isEmpty()) {
            details.append("\nIssues:");
            state.errors().forEach(error -> details.append("\n- ")
                    .append(error.stage()).append(" [").append(error.kind()).append("] ").append(error.message()));
        }
        if (!state.feedbackHistory().isEmpty()) {
            details.append("\nFeedback rounds: ").append(state.feedbackHistory().size());
        }
        return details.toString();
    }

    private static String describe(TaskResult result) {
        String summary = result.summary().isBlank() ? "" : " - " + result.summary();
        return result.marker().name().toLowerCase() + summary;
    }
}
