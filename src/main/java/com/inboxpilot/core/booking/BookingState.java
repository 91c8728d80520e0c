package com.inboxpilot.core.booking;

import com.inboxpilot.core.interrupt.PendingInterrupt;
import com.inboxpilot.core.interrupt.ResolutionKind;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.state.StateReducers;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.List;
import java.util.Map;

/**
 * State of the nested booking workflow. Lives only for one sub-graph run; the scheduling
 * stage copies the resulting {@link SchedulingOutcome} into the conversation.
 */
public class BookingState extends AgentState {

    public static final String CONVERSATION_ID = "conversationId";
    public static final String EPOCH = "epoch";
    public static final String MEETING = "meeting";
    public static final String TASK = "task";
    public static final String OUTCOME = "outcome";
    public static final String DECISION = "decision";
    public static final String ROUTE = "route";
    public static final String PENDING_INTERRUPT = "pendingInterrupt";
    public static final String TRANSCRIPT = "transcript";
    public static final String ERRORS = "errors";

    static final String ROUTE_REVIEW = "review";
    static final String ROUTE_BOOK = "book";
    static final String ROUTE_EXIT = "exit";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            CONVERSATION_ID, Channels.base(StateReducers.<String>overwrite(), () -> ""),
            EPOCH, Channels.base(StateReducers.<Integer>overwrite(), () -> 1),
            MEETING, Channels.base(StateReducers.<MeetingRequest>overwrite(), MeetingRequest::none),
            TASK, Channels.base(StateReducers.<String>overwrite(), () -> ""),
            OUTCOME, Channels.base(StateReducers.<SchedulingOutcome>overwrite(), SchedulingOutcome::notRequested),
            DECISION, Channels.base(StateReducers.<ResolutionKind>overwrite(), () -> ResolutionKind.NONE),
            ROUTE, Channels.base(StateReducers.<String>overwrite(), () -> ROUTE_EXIT),
            PENDING_INTERRUPT, Channels.base(StateReducers.<PendingInterrupt>overwrite(), PendingInterrupt::none),
            TRANSCRIPT, Channels.base(StateReducers.<String>concat(), List::of),
            ERRORS, Channels.base(StateReducers.<StageError>concat(), List::of)
    );

    public BookingState(Map<String, Object> initData) {
        super(initData);
    }

    public String conversationId() {
        return this.<String>value(CONVERSATION_ID).orElse("");
    }

    public int epoch() {
        return this.<Integer>value(EPOCH).orElse(1);
    }

    public MeetingRequest meeting() {
        return this.<MeetingRequest>value(MEETING).orElse(MeetingRequest.none());
    }

    public String task() {
        return this.<String>value(TASK).orElse("");
    }

    public SchedulingOutcome outcome() {
        return this.<SchedulingOutcome>value(OUTCOME).orElse(SchedulingOutcome.notRequested());
    }

    public ResolutionKind decision() {
        return this.<ResolutionKind>value(DECISION).orElse(ResolutionKind.NONE);
    }

    public boolean hasDecision() {
        return decision() != ResolutionKind.NONE;
    }

    public String route() {
        return this.<String>value(ROUTE).orElse(ROUTE_EXIT);
    }

    public PendingInterrupt pendingInterrupt() {
        return this.<PendingInterrupt>value(PENDING_INTERRUPT).orElse(PendingInterrupt.none());
    }

    public List<String> transcript() {
        return this.<List<String>>value(TRANSCRIPT).orElse(List.of());
    }

    public List<StageError> errors() {
        return this.<List<StageError>>value(ERRORS).orElse(List.of());
    }
}
