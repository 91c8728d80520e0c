package com.inboxpilot.core.nodes;

import com.inboxpilot.core.booking.BookingGraph;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.interrupt.InterruptResolution;
import com.inboxpilot.core.interrupt.ResolutionKind;
import com.inboxpilot.core.model.BookingStatus;
import com.inboxpilot.core.model.CompletionMarker;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.InterpretationException;
import com.inboxpilot.integration.MessageInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;

/**
 * Scheduling stage: extracts meeting requirements and runs the booking sub-workflow.
 * <p>
 * When the sub-workflow suspends for booking approval the stage stays PENDING and the
 * conversation carries the booking interrupt. On resume the stored outcome is handed back to
 * the sub-workflow together with the reviewer's decision, so the availability check is not
 * repeated.
 */
@Component
public class SchedulingNode implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(SchedulingNode.class);

    private final MessageInterpreter interpreter;
    private final BookingGraph bookingGraph;
    private final StageExecutor executor;

    public SchedulingNode(MessageInterpreter interpreter, BookingGraph bookingGraph, StageExecutor executor) {
        this.interpreter = interpreter;
        this.bookingGraph = bookingGraph;
        this.executor = executor;
    }

    @Override
    public StageKind kind() {
        return StageKind.SCHEDULING;
    }

    public Map<String, Object> apply(ConversationState state) {
        return executor.execute(this, state);
    }

    @Override
    public StageOutcome execute(ConversationState state) {
        String task = state.routingPlan().map(plan -> plan.taskFor(StageKind.SCHEDULING)).orElse("");
        InterruptResolution resolution = state.resolution();

        BookingGraph.Result result;
        boolean resumed = false;
        if (isBookingDecision(resolution, state.epoch())) {
            var stored = state.taskResult(StageKind.SCHEDULING)
                    .map(TaskResult::scheduling)
                    .orElse(null);
            if (stored == null) {
                log.warn("Booking decision present but no stored scheduling outcome; re-running availability");
                result = analyze(state, task);
            } else {
                log.info("Applying booking decision {} for epoch {}", resolution.kind(), resolution.epoch());
                result = bookingGraph.decide(state.conversationId(), state.epoch(), stored, resolution.kind());
                resumed = true;
            }
        } else {
            result = analyze(state, task);
        }
        if (result == null) {
            return StageOutcome.failure(
                    TaskResult.failed(StageKind.SCHEDULING, task, "Meeting requirements unavailable", state.epoch()),
                    StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                            "Meeting requirement extraction failed"));
        }

        SchedulingOutcome outcome = result.outcome();
        CompletionMarker marker = switch (outcome.status()) {
            case AWAITING_APPROVAL -> CompletionMarker.PENDING;
            case FAILED -> CompletionMarker.FAILED;
            default -> CompletionMarker.SUCCESS;
        };
        var messages = new ArrayList<String>();
        result.state().transcript().forEach(line -> messages.add("scheduling/" + line));
        var stageOutcome = new StageOutcome(
                TaskResult.scheduled(task, outcome, marker, state.epoch()),
                result.state().errors(), messages, Map.of());
        if (outcome.status() == BookingStatus.AWAITING_APPROVAL) {
            stageOutcome = stageOutcome.with(ConversationState.PENDING_INTERRUPT, result.state().pendingInterrupt());
        }
        if (outcome.status() == BookingStatus.FAILED && stageOutcome.errors().isEmpty()) {
            stageOutcome = stageOutcome.withError(StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                    outcome.note()));
        }
        if (resumed) {
            stageOutcome = stageOutcome.with(ConversationState.RESOLUTION, InterruptResolution.none());
        }
        if (outcome.status() == BookingStatus.BOOKED && outcome.eventId() != null) {
            stageOutcome = stageOutcome.with(ConversationState.COMMITTED_EFFECTS,
                    Map.of(state.effectKey("book"), outcome.eventId()));
        }
        return stageOutcome;
    }

    private BookingGraph.Result analyze(ConversationState state, String task) {
        var email = state.request().orElse(null);
        if (email == null) {
            return null;
        }
        ExtractedContext context = state.extractedContext().orElse(null);
        MeetingRequest meeting;
        try {
            meeting = interpreter.extractMeetingRequirements(email, context, task);
        } catch (InterpretationException e) {
            log.warn("Meeting requirement extraction failed: {}", e.getMessage());
            return null;
        }
        return bookingGraph.analyze(state.conversationId(), state.epoch(), meeting, task);
    }

    private static boolean isBookingDecision(InterruptResolution resolution, int epoch) {
        return resolution.isFor(InterruptPoint.BOOKING_REVIEW)
                && resolution.epoch() == epoch
                && (resolution.kind() == ResolutionKind.APPROVED || resolution.kind() == ResolutionKind.REJECTED);
    }
}
