package com.inboxpilot.core.persistence;

import com.inboxpilot.core.interrupt.InterruptResolution;
import com.inboxpilot.core.interrupt.PendingInterrupt;
import com.inboxpilot.core.model.*;
import com.inboxpilot.core.state.ConversationState;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable, typed copy of a {@link ConversationState}. Restoring it with {@link #toStateMap()}
 * yields exactly the state that was saved.
 */
public record ConversationSnapshot(
        String conversationId,
        InboundEmail request,
        ExtractedContext extractedContext,
        Map<StageKind, TaskResult> taskData,
        String draftOutput,
        RoutingPlan routingPlan,
        String pendingFeedback,
        ConversationStatus status,
        List<StageError> errors,
        int epoch,
        List<String> messages,
        List<String> insights,
        Map<String, Integer> counters,
        List<FeedbackEntry> feedbackHistory,
        PendingInterrupt pendingInterrupt,
        InterruptResolution resolution,
        EntryPoint entryPoint,
        RoutingDecision lastDecision,
        Map<String, String> committedEffects,
        boolean archived,
        Instant updatedAt
) {

    public static ConversationSnapshot of(ConversationState state, Instant updatedAt) {
        return new ConversationSnapshot(
                state.conversationId(),
                state.request().orElse(null),
                state.extractedContext().orElse(null),
                state.taskData(),
                state.draftOutput(),
                state.routingPlan().orElse(null),
                state.pendingFeedback(),
                state.status(),
                state.errors(),
                state.epoch(),
                state.messages(),
                state.insights(),
                state.counters(),
                state.feedbackHistory(),
                state.pendingInterrupt(),
                state.resolution(),
                state.entryPoint(),
                state.lastDecision().orElse(null),
                state.committedEffects(),
                false,
                updatedAt);
    }

    public boolean isAwaitingInput() {
        return !archived && pendingInterrupt != null && pendingInterrupt.isActive();
    }

    public ConversationSnapshot archive(Instant at) {
        return new ConversationSnapshot(conversationId, request, extractedContext, taskData, draftOutput,
                routingPlan, pendingFeedback, status, errors, epoch, messages, insights, counters,
                feedbackHistory, pendingInterrupt, resolution, entryPoint, lastDecision, committedEffects,
                true, at);
    }

    public Map<String, Object> toStateMap() {
        var map = new HashMap<String, Object>();
        put(map, ConversationState.CONVERSATION_ID, conversationId);
        put(map, ConversationState.REQUEST, request);
        put(map, ConversationState.EXTRACTED_CONTEXT, extractedContext);
        put(map, ConversationState.TASK_DATA, taskData == null ? null : Map.copyOf(taskData));
        put(map, ConversationState.DRAFT_OUTPUT, draftOutput);
        put(map, ConversationState.ROUTING_PLAN, routingPlan);
        put(map, ConversationState.PENDING_FEEDBACK, pendingFeedback);
        put(map, ConversationState.STATUS, status);
        put(map, ConversationState.ERRORS, errors == null ? null : List.copyOf(errors));
        put(map, ConversationState.EPOCH, epoch);
        put(map, ConversationState.MESSAGES, messages == null ? null : List.copyOf(messages));
        put(map, ConversationState.INSIGHTS, insights == null ? null : List.copyOf(insights));
        put(map, ConversationState.COUNTERS, counters == null ? null : Map.copyOf(counters));
        put(map, ConversationState.FEEDBACK_HISTORY, feedbackHistory == null ? null : List.copyOf(feedbackHistory));
        put(map, ConversationState.PENDING_INTERRUPT, pendingInterrupt);
        put(map, ConversationState.RESOLUTION, resolution);
        put(map, ConversationState.ENTRY_POINT, entryPoint);
        put(map, ConversationState.LAST_DECISION, lastDecision);
        put(map, ConversationState.COMMITTED_EFFECTS, committedEffects == null ? null : Map.copyOf(committedEffects));
        return map;
    }

    private static void put(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
