package com.inboxpilot.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inboxpilot.core.interrupt.ActionRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.persistence.ConversationSnapshot;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON view of a conversation. Never includes the subjects of other calendar events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationResponse(
        @JsonProperty("conversation_id") String conversationId,
        String status,
        int epoch,
        String subject,
        String draft,
        @JsonProperty("awaiting_input") boolean awaitingInput,
        @JsonProperty("interrupt_point") String interruptPoint,
        @JsonProperty("action_request") ActionRequest actionRequest,
        Map<String, String> stages,
        BookingView booking,
        List<StageError> errors,
        List<String> messages,
        boolean archived,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public record BookingView(
            String status,
            @JsonProperty("requested_start") LocalDateTime requestedStart,
            List<LocalDateTime> alternatives,
            @JsonProperty("event_id") String eventId,
            String note
    ) {}

    public static ConversationResponse from(ConversationSnapshot snapshot) {
        var stages = new TreeMap<String, String>();
        snapshot.taskData().forEach((stage, result) -> stages.put(stage.wireName(), result.marker().name()));
        var pending = snapshot.pendingInterrupt();
        boolean awaiting = snapshot.isAwaitingInput();
        return new ConversationResponse(
                snapshot.conversationId(),
                snapshot.status().name(),
                snapshot.epoch(),
                snapshot.request() == null ? null : snapshot.request().subject(),
                snapshot.draftOutput(),
                awaiting,
                awaiting ? pending.point().name() : null,
                awaiting ? pending.request() : null,
                stages,
                booking(snapshot.taskData().get(StageKind.SCHEDULING)),
                snapshot.errors(),
                snapshot.messages(),
                snapshot.archived(),
                snapshot.updatedAt());
    }

    private static BookingView booking(TaskResult scheduling) {
        if (scheduling == null || scheduling.scheduling() == null) {
            return null;
        }
        SchedulingOutcome outcome = scheduling.scheduling();
        return new BookingView(
                outcome.status().name(),
                outcome.requestedSlot() == null ? null : outcome.requestedSlot().start(),
                outcome.alternatives(),
                outcome.eventId(),
                outcome.note());
    }
}
