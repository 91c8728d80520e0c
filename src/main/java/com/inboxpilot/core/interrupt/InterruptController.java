package com.inboxpilot.core.interrupt;

import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.EntryPoint;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.state.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Suspend/resume protocol for human-in-the-loop approval.
 * <p>
 * Stages call {@link #raise} to record what they are waiting for; the engine then persists
 * the snapshot and returns. On resume, {@link #resolve} classifies the human response and
 * {@link #resumePlan} turns it into the state update and entry point for the next graph run.
 * <pre>
 *   drafting -> awaiting_human -> approved | rejected | modified | edited | no_response
 * </pre>
 * A missing or late response always resolves to {@code no_response}, which is handled like
 * {@code ignore} and never performs an action. Accepting an error review retries: a failed send
 * is sent again in the same epoch, any other failure is re-routed in a new epoch.
 */
@Component
public class InterruptController {

    private static final Logger log = LoggerFactory.getLogger(InterruptController.class);

    /** What the engine does after an interrupt is resolved. */
    public record ResumePlan(Map<String, Object> update, EntryPoint entryPoint, boolean runGraph) {}

    private static final String SEND_STAGE = "send";

    private final Clock clock;
    private final InboxMetrics metrics;

    public InterruptController(Clock clock, InboxMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public PendingInterrupt raise(InterruptPoint point, ActionRequest request, int epoch) {
        Instant now = clock.instant();
        Instant deadline = request.timeoutSeconds() == null ? null : now.plusSeconds(request.timeoutSeconds());
        log.info("Raising {} interrupt '{}' (epoch {}, deadline {})", point, request.action(), epoch, deadline);
        metrics.recordInterruptRaised(point.name());
        return new PendingInterrupt(point, request, epoch, now, deadline);
    }

    /**
     * Classifies a human response against the pending interrupt.
     *
     * @throws IllegalStateException    when nothing is pending
     * @throws IllegalArgumentException when the response kind is not allowed or lacks feedback text
     */
    public InterruptResolution resolve(PendingInterrupt pending, HumanResponse response) {
        if (!pending.isActive()) {
            throw new IllegalStateException("No interrupt is pending");
        }
        if (pending.isExpired(clock.instant())) {
            log.info("Response arrived after the {} deadline; treating as no response", pending.point());
            return timeout(pending);
        }
        if (response == null || response.type() == null) {
            throw new IllegalArgumentException("Response type is required");
        }
        if (!pending.request().allows(response.type())) {
            throw new IllegalArgumentException("Response '" + response.type().wireName()
                    + "' is not allowed for action '" + pending.request().action() + "'");
        }
        ResolutionKind kind = switch (response.type()) {
            case ACCEPT -> ResolutionKind.APPROVED;
            case IGNORE -> ResolutionKind.REJECTED;
            case RESPONSE -> ResolutionKind.MODIFIED;
            case EDIT -> ResolutionKind.EDITED;
        };
        String feedback = kind.carriesFeedback() ? response.argsAsText().trim() : "";
        if (kind.carriesFeedback() && feedback.isEmpty()) {
            throw new IllegalArgumentException("A '" + response.type().wireName() + "' response needs args");
        }
        return new InterruptResolution(pending.point(), kind, feedback, pending.epoch());
    }

    public InterruptResolution timeout(PendingInterrupt pending) {
        return new InterruptResolution(pending.point(), ResolutionKind.NO_RESPONSE, "", pending.epoch());
    }

    public ResumePlan resumePlan(ConversationState state, InterruptResolution resolution) {
        metrics.recordInterruptResolved(resolution.point().name(), resolution.kind().name());
        var update = new HashMap<String, Object>();
        update.put(ConversationState.PENDING_INTERRUPT, PendingInterrupt.none());
        update.put(ConversationState.RESOLUTION, resolution);
        String stage = stageLabel(resolution.point());

        if (resolution.kind() == ResolutionKind.NO_RESPONSE) {
            update.put(ConversationState.STATUS, ConversationStatus.REJECTED);
            update.put(ConversationState.ERRORS, List.of(new StageError(stage, ErrorKind.TIMEOUT,
                    "No response before the deadline; treated as ignore")));
            update.put(ConversationState.MESSAGES, List.of(stage + ": timed out"));
            return new ResumePlan(update, state.entryPoint(), false);
        }
        if (resolution.kind().carriesFeedback()) {
            update.put(ConversationState.PENDING_FEEDBACK, resolution.feedback());
            update.put(ConversationState.STATUS, ConversationStatus.PROCESSING);
            update.put(ConversationState.EPOCH, state.epoch() + 1);
            update.put(ConversationState.ENTRY_POINT, EntryPoint.ROUTER);
            update.put(ConversationState.MESSAGES, List.of(stage + ": feedback received"));
            return new ResumePlan(update, EntryPoint.ROUTER, true);
        }

        boolean approved = resolution.kind() == ResolutionKind.APPROVED;
        if (resolution.point() == InterruptPoint.ERROR_REVIEW && approved) {
            return retry(state, update, stage);
        }
        if (resolution.point() == InterruptPoint.BOOKING_REVIEW) {
            update.put(ConversationState.ENTRY_POINT, EntryPoint.SCHEDULING);
            update.put(ConversationState.MESSAGES, List.of(stage + ": " + (approved ? "accepted" : "declined")));
            return new ResumePlan(update, EntryPoint.SCHEDULING, true);
        }
        if (approved) {
            update.put(ConversationState.STATUS, ConversationStatus.APPROVED);
            update.put(ConversationState.ENTRY_POINT, EntryPoint.SEND);
            update.put(ConversationState.MESSAGES, List.of(stage + ": accepted"));
            return new ResumePlan(update, EntryPoint.SEND, true);
        }
        update.put(ConversationState.STATUS, ConversationStatus.REJECTED);
        update.put(ConversationState.MESSAGES, List.of(stage + ": ignored"));
        return new ResumePlan(update, state.entryPoint(), false);
    }

    private ResumePlan retry(ConversationState state, Map<String, Object> update, String stage) {
        Object failedStage = state.pendingInterrupt().request() == null ? null
                : state.pendingInterrupt().request().args().get(ActionRequests.FAILED_STAGE);
        if (SEND_STAGE.equals(failedStage) && !state.draftOutput().isBlank()) {
            log.info("Retrying the send of the approved draft (epoch {})", state.epoch());
            update.put(ConversationState.STATUS, ConversationStatus.APPROVED);
            update.put(ConversationState.ENTRY_POINT, EntryPoint.SEND);
            update.put(ConversationState.MESSAGES, List.of(stage + ": retrying send"));
            return new ResumePlan(update, EntryPoint.SEND, true);
        }
        EntryPoint entry = state.extractedContext().isPresent() ? EntryPoint.ROUTER : EntryPoint.PARSE;
        log.info("Retrying after a {} failure in epoch {} from {}", failedStage, state.epoch() + 1, entry);
        update.put(ConversationState.STATUS, ConversationStatus.PROCESSING);
        update.put(ConversationState.EPOCH, state.epoch() + 1);
        update.put(ConversationState.ENTRY_POINT, entry);
        update.put(ConversationState.MESSAGES, List.of(stage + ": retrying"));
        return new ResumePlan(update, entry, true);
    }

    private static String stageLabel(InterruptPoint point) {
        return switch (point) {
            case BOOKING_REVIEW -> "booking_review";
            case ERROR_REVIEW -> "error_review";
            default -> "draft_review";
        };
    }
}
