package com.inboxpilot.core.nodes;

import com.inboxpilot.core.model.CompletionMarker;
import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.FeedbackEntry;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.ComposeContext;
import com.inboxpilot.integration.InterpretationException;
import com.inboxpilot.integration.MessageInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the reply draft from everything the workers gathered.
 * <p>
 * On refinement passes the previous draft and the feedback history are included. When the
 * interpreter fails a plain template draft is produced instead, so review always has something
 * to show. The finished draft is scrubbed of withheld event subjects before it is stored.
 */
@Component
public class ComposeResponseNode implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(ComposeResponseNode.class);

    static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("EEEE d MMMM yyyy 'at' HH:mm", Locale.ENGLISH);

    private final MessageInterpreter interpreter;
    private final StageExecutor executor;

    public ComposeResponseNode(MessageInterpreter interpreter, StageExecutor executor) {
        this.interpreter = interpreter;
        this.executor = executor;
    }

    @Override
    public StageKind kind() {
        return StageKind.COMPOSE;
    }

    public Map<String, Object> apply(ConversationState state) {
        return executor.execute(this, state);
    }

    @Override
    public StageOutcome execute(ConversationState state) {
        InboundEmail email = state.request().orElseThrow(() ->
                new IllegalStateException("Cannot compose without a request"));
        SchedulingOutcome scheduling = state.taskResult(StageKind.SCHEDULING)
                .map(TaskResult::scheduling)
                .orElse(null);
        ComposeContext context = buildContext(state, email, scheduling);
        List<String> withheld = scheduling == null ? List.of() : scheduling.withheldSubjects();

        String draft;
        StageError error = null;
        try {
            draft = interpreter.composeReply(context);
            if (draft == null || draft.isBlank()) {
                throw new InterpretationException("Composer returned an empty draft");
            }
        } catch (InterpretationException e) {
            log.warn("Composer failed, using template draft: {}", e.getMessage());
            draft = fallbackDraft(context);
            error = StageError.of(StageKind.COMPOSE, ErrorKind.EXTERNAL_SERVICE,
                    "Composer unavailable, template draft used: " + e.getMessage());
        }
        if (DisclosureGuard.discloses(draft, withheld)) {
            log.info("Draft mentioned a private event subject; redacting");
            draft = DisclosureGuard.redact(draft, withheld);
        }

        String summary = context.isRevision() ? "Draft revised" : "Draft composed";
        var outcome = StageOutcome.success(
                        TaskResult.success(StageKind.COMPOSE, "", summary, List.of(), state.epoch()),
                        "compose: " + summary.toLowerCase(Locale.ROOT))
                .with(ConversationState.DRAFT_OUTPUT, draft);
        return error == null ? outcome : outcome.withError(error);
    }

    ComposeContext buildContext(ConversationState state, InboundEmail email, SchedulingOutcome scheduling) {
        var gaps = new ArrayList<String>();
        if (state.extractedContext().isEmpty()) {
            gaps.add("The request could not be fully understood; ask the sender to clarify.");
        }
        for (StageKind stage : List.of(StageKind.SCHEDULING, StageKind.KNOWLEDGE, StageKind.CONTACT)) {
            state.taskResult(stage)
                    .filter(result -> result.marker() == CompletionMarker.FAILED)
                    .ifPresent(result -> gaps.add(stage.wireName() + " information is currently unavailable."));
        }

        List<DirectoryRecord> knowledge = records(state, StageKind.KNOWLEDGE);
        List<DirectoryRecord> contacts = records(state, StageKind.CONTACT);
        List<String> feedback = state.feedbackHistory().stream()
                .map(FeedbackEntry::instructions)
                .filter(text -> text != null && !text.isBlank())
                .toList();
        String previousDraft = feedback.isEmpty() ? "" : state.draftOutput();

        return new ComposeContext(
                email,
                state.extractedContext().orElse(null),
                describeAvailability(scheduling),
                scheduling == null ? List.of() : scheduling.alternatives(),
                knowledge,
                contacts,
                gaps,
                previousDraft,
                feedback);
    }

    /** Availability as the requester may see it. Never names other events. */
    static String describeAvailability(SchedulingOutcome scheduling) {
        if (scheduling == null) {
            return "";
        }
        String requested = scheduling.requestedSlot() == null
                ? "the requested time"
                : format(scheduling.requestedSlot().start());
        return switch (scheduling.status()) {
            case NOT_REQUESTED -> "";
            case CONFLICT -> "The calendar owner is not available on " + requested + ".";
            case AVAILABLE, AWAITING_APPROVAL, APPROVED -> "The calendar owner is available on " + requested + ".";
            case BOOKED -> "The meeting is booked for " + requested + ".";
            case DECLINED -> "The meeting on " + requested + " was not booked.";
            case UNRESOLVED -> "No meeting time could be confirmed yet.";
            case FAILED -> "The calendar could not be checked.";
        };
    }

    static String fallbackDraft(ComposeContext context) {
        var body = new StringBuilder();
        body.append("Hello,\n\n");
        String subject = context.email().subject() == null ? "" : context.email().subject().trim();
        body.append(subject.isEmpty()
                ? "Thank you for your message."
                : "Thank you for your message about \"" + subject + "\".");
        if (!context.availability().isBlank()) {
            body.append(' ').append(context.availability());
        }
        if (!context.alternatives().isEmpty()) {
            body.append("\n\nI could offer instead:");
            context.alternatives().forEach(alt -> body.append("\n- ").append(format(alt)));
        }
        for (String gap : context.gaps()) {
            body.append("\n\n").append(gap);
        }
        body.append("\n\nI will follow up shortly.\n\nBest regards");
        return body.toString();
    }

    static String format(LocalDateTime time) {
        return SLOT_FORMAT.format(time);
    }

    private static List<DirectoryRecord> records(ConversationState state, StageKind stage) {
        return state.taskResult(stage)
                .filter(TaskResult::succeeded)
                .map(TaskResult::records)
                .orElse(List.of());
    }
}
