package com.inboxpilot.core.interrupt;

import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;

import java.time.Duration;
import java.util.LinkedHashMap;

/**
 * Builds the action requests shown at each interrupt point.
 */
public final class ActionRequests {

    static final int MAX_ACTION_SUBJECT = 50;

    /** Arg naming the stage whose failure an error review acknowledges. */
    public static final String FAILED_STAGE = "failed_stage";

    private ActionRequests() {}

    public static ActionRequest draftReview(InboundEmail email, String draft, String reviewDetails, Duration timeout) {
        var emailContext = new LinkedHashMap<String, Object>();
        emailContext.put("from", nullToEmpty(email.sender()));
        emailContext.put("subject", nullToEmpty(email.subject()));
        emailContext.put("body", excerpt(nullToEmpty(email.body()), 500));

        var args = new LinkedHashMap<String, Object>();
        args.put("draft_response", draft);
        args.put("email_context", emailContext);
        args.put("review_details", reviewDetails);
        args.put("message", "Review the draft reply. Accept to send it, ignore to discard it, "
                + "or respond with changes.");
        return new ActionRequest("Review: " + excerpt(nullToEmpty(email.subject()), MAX_ACTION_SUBJECT),
                args, true, true, true, true, seconds(timeout));
    }

    public static ActionRequest bookingReview(MeetingRequest meeting, SchedulingOutcome outcome, Duration timeout) {
        var details = new LinkedHashMap<String, Object>();
        details.put("title", nullToEmpty(meeting.title()));
        details.put("start", outcome.requestedSlot().start().toString());
        details.put("end", outcome.requestedSlot().end().toString());
        details.put("duration_minutes", meeting.durationMinutes());
        details.put("attendees", meeting.attendees());

        var args = new LinkedHashMap<String, Object>();
        args.put("booking_details", details);
        args.put("requirements", meeting.notes());
        args.put("message", "The requested slot is free. Accept to create the event, ignore to skip booking, "
                + "or respond with a different time.");
        return new ActionRequest("Book: " + excerpt(nullToEmpty(meeting.title()), MAX_ACTION_SUBJECT),
                args, true, true, true, false, seconds(timeout));
    }

    /**
     * Error acknowledgment. Accept retries the failed work, ignore gives up on the conversation,
     * respond retries with instructions.
     */
    public static ActionRequest errorReview(InboundEmail email, StageError failure, String draft, Duration timeout) {
        String subject = email == null ? "" : nullToEmpty(email.subject());
        var error = new LinkedHashMap<String, Object>();
        error.put("stage", failure.stage());
        error.put("kind", failure.kind().name());
        error.put("message", nullToEmpty(failure.message()));

        var args = new LinkedHashMap<String, Object>();
        args.put(FAILED_STAGE, failure.stage());
        args.put("error", error);
        args.put("draft_response", nullToEmpty(draft));
        args.put("message", "Processing failed at " + failure.stage() + ". Accept to retry, ignore to close "
                + "the conversation without a reply, or respond with instructions for the retry.");
        return new ActionRequest("Error: " + excerpt(subject, MAX_ACTION_SUBJECT),
                args, true, true, true, false, seconds(timeout));
    }

    private static Integer seconds(Duration timeout) {
        return timeout == null ? null : Math.toIntExact(timeout.toSeconds());
    }

    static String excerpt(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
