package com.inboxpilot.core.nodes;

import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.*;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.ComposeContext;
import com.inboxpilot.integration.InterpretationException;
import com.inboxpilot.integration.MessageInterpreter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ComposeResponseNodeTest {

    private static final LocalDateTime TEN = LocalDateTime.of(2025, 3, 4, 10, 0);
    private static final InboundEmail EMAIL = new InboundEmail("m-1", "t-1", "sam@example.com",
            "Meeting Tuesday", "Can we meet Tuesday at 10?", Instant.parse("2025-03-03T08:00:00Z"));
    private static final ExtractedContext CONTEXT = new ExtractedContext(
            List.of("Tuesday"), List.of("Tuesday 10:00"), List.of("schedule meeting"), "medium", "neutral", true);

    private MessageInterpreter interpreter;
    private ComposeResponseNode node;

    @BeforeEach
    void setUp() {
        interpreter = mock(MessageInterpreter.class);
        node = new ComposeResponseNode(interpreter, new StageExecutor(new InboxMetrics(new SimpleMeterRegistry())));
    }

    private static SchedulingOutcome conflict() {
        var meeting = new MeetingRequest(true, "Sync", TEN, 60, List.of(), "");
        return new SchedulingOutcome(BookingStatus.CONFLICT, meeting, TimeSlot.of(TEN, 60), TimeSlot.of(TEN, 60),
                List.of(TEN.withHour(11), TEN.withHour(14)), List.of("1 overlapping event"),
                List.of("Board offsite"), null, null, "Requested time is taken");
    }

    private static ConversationState state(Map<String, Object> extra) {
        var data = new HashMap<String, Object>();
        data.put(ConversationState.CONVERSATION_ID, "CONV-1");
        data.put(ConversationState.REQUEST, EMAIL);
        data.put(ConversationState.EXTRACTED_CONTEXT, CONTEXT);
        data.putAll(extra);
        return new ConversationState(data);
    }

    private static ConversationState conflictState() {
        return state(Map.of(ConversationState.TASK_DATA, Map.of(StageKind.SCHEDULING,
                TaskResult.scheduled("check Tuesday", conflict(), CompletionMarker.SUCCESS, 1))));
    }

    @Test
    @DisplayName("the composer sees availability and alternatives but never the other event's subject")
    void composeContextHidesSubjects() {
        when(interpreter.composeReply(any())).thenReturn("Tuesday at 10 does not work, how about 11?");

        node.apply(conflictState());

        var captor = ArgumentCaptor.forClass(ComposeContext.class);
        verify(interpreter).composeReply(captor.capture());
        var context = captor.getValue();
        assertEquals("The calendar owner is not available on Tuesday 4 March 2025 at 10:00.", context.availability());
        assertEquals(List.of(TEN.withHour(11), TEN.withHour(14)), context.alternatives());
        assertFalse(context.toString().contains("Board offsite"));
    }

    @Test
    @DisplayName("a draft that names a withheld subject is redacted")
    void redactsDraft() {
        when(interpreter.composeReply(any())).thenReturn("Sorry, I am at the board offsite on Tuesday.");

        var update = node.apply(conflictState());

        assertEquals("Sorry, I am at the another commitment on Tuesday.", update.get(ConversationState.DRAFT_OUTPUT));
    }

    @Test
    @DisplayName("a failing composer yields the template draft and an external service error")
    void fallbackDraft() {
        when(interpreter.composeReply(any())).thenThrow(new InterpretationException("model unavailable"));

        var update = node.apply(conflictState());

        var draft = (String) update.get(ConversationState.DRAFT_OUTPUT);
        assertTrue(draft.startsWith("Hello,"));
        assertTrue(draft.contains("Thank you for your message about \"Meeting Tuesday\"."));
        assertTrue(draft.contains("- Tuesday 4 March 2025 at 11:00"));
        assertFalse(draft.contains("Board offsite"));
        @SuppressWarnings("unchecked")
        var errors = (List<StageError>) update.get(ConversationState.ERRORS);
        assertEquals(ErrorKind.EXTERNAL_SERVICE, errors.get(0).kind());
        @SuppressWarnings("unchecked")
        var taskData = (Map<StageKind, TaskResult>) update.get(ConversationState.TASK_DATA);
        assertEquals(CompletionMarker.SUCCESS, taskData.get(StageKind.COMPOSE).marker());
    }

    @Test
    @DisplayName("a blank draft is treated like a failed composer")
    void blankDraft() {
        when(interpreter.composeReply(any())).thenReturn("  ");

        var update = node.apply(state(Map.of()));

        assertTrue(((String) update.get(ConversationState.DRAFT_OUTPUT)).contains("I will follow up shortly."));
    }

    @Test
    @DisplayName("refinement passes carry the previous draft and the feedback history")
    void revisionContext() {
        var feedback = new FeedbackEntry(1, "make it shorter", FeedbackDomain.RESPONSE_ONLY,
                FeedbackDecision.MODIFIED, "Shorten the reply");
        var revising = state(Map.of(
                ConversationState.DRAFT_OUTPUT, "A long first draft",
                ConversationState.EPOCH, 2,
                ConversationState.FEEDBACK_HISTORY, List.of(feedback)));
        when(interpreter.composeReply(any())).thenReturn("Short draft");

        var update = node.apply(revising);

        var captor = ArgumentCaptor.forClass(ComposeContext.class);
        verify(interpreter).composeReply(captor.capture());
        assertTrue(captor.getValue().isRevision());
        assertEquals("A long first draft", captor.getValue().previousDraft());
        assertEquals(List.of("Shorten the reply"), captor.getValue().feedback());
        assertEquals(List.of("compose: draft revised"), update.get(ConversationState.MESSAGES));
    }

    @Test
    @DisplayName("failed workers and a missing context become gaps")
    void gaps() {
        var failedState = new ConversationState(Map.of(
                ConversationState.CONVERSATION_ID, "CONV-1",
                ConversationState.REQUEST, EMAIL,
                ConversationState.TASK_DATA, Map.of(StageKind.KNOWLEDGE,
                        TaskResult.failed(StageKind.KNOWLEDGE, "", "Document search failed", 1))));

        var context = node.buildContext(failedState, EMAIL, null);

        assertEquals(List.of(
                "The request could not be fully understood; ask the sender to clarify.",
                "knowledge information is currently unavailable."), context.gaps());
        assertEquals("", context.availability());
    }

    @Test
    @DisplayName("availability wording follows the booking status")
    void describeAvailability() {
        var booked = conflict().withEvent(new CreatedEvent("evt-1", "link"));

        assertEquals("The meeting is booked for Tuesday 4 March 2025 at 10:00.",
                ComposeResponseNode.describeAvailability(booked));
        assertEquals("", ComposeResponseNode.describeAvailability(SchedulingOutcome.notRequested()));
        assertEquals("No meeting time could be confirmed yet.", ComposeResponseNode.describeAvailability(
                conflict().withStatus(BookingStatus.UNRESOLVED, "")));
    }
}
