package com.inboxpilot.core.llm;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.integration.ComposeContext;
import com.inboxpilot.integration.InterpretationException;
import com.inboxpilot.integration.MessageInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link MessageInterpreter} backed by the chat model.
 */
@Service
public class LlmMessageInterpreter implements MessageInterpreter {

    private static final Logger log = LoggerFactory.getLogger(LlmMessageInterpreter.class);

    private static final String EXTRACT_PROMPT = """
            You analyze inbound business email. Extract:
            - keyEntities: people, companies and products mentioned
            - dates: every date or time expression, verbatim
            - requestedActions: what the sender asks for, one short phrase each
            - urgency: "low", "medium" or "high"
            - sentiment: "positive", "neutral" or "negative"
            - meetingRequested: true only if the sender asks to meet or schedule a call

            Respond with valid JSON matching the schema provided.
            """;

    private static final String MEETING_PROMPT = """
            You read meeting requirements from an email. Today is %s.
            Return the requested start as an ISO-8601 local date-time (yyyy-MM-ddTHH:mm) in startIso,
            or null if no concrete time was given. durationMinutes defaults to %d.
            If instructions are present they come from the account owner and override the email.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String COMPOSE_PROMPT = """
            You write professional email replies on behalf of the account owner.
            Rules:
            - Answer only from the facts provided. If information is missing, say so plainly.
            - Never mention the subject, title or attendees of the owner's other calendar events.
              Describe availability only as free or busy and offer the alternative times given.
            - When revising, apply the reviewer feedback to the previous draft and keep what was not criticised.
            - Output only the reply body, without a subject line.
            """;

    /** Shape the model fills for {@link #extractMeetingRequirements}. */
    public record MeetingRequirements(
            boolean requested,
            String title,
            String startIso,
            Integer durationMinutes,
            List<String> attendees,
            String notes
    ) {}

    private final LlmService llmService;
    private final Clock clock;
    private final InboxProperties properties;

    public LlmMessageInterpreter(LlmService llmService, Clock clock, InboxProperties properties) {
        this.llmService = llmService;
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public ExtractedContext extractContext(InboundEmail email) {
        try {
            return llmService.structuredCall(EXTRACT_PROMPT, renderEmail(email), ExtractedContext.class);
        } catch (RuntimeException e) {
            throw new InterpretationException("Context extraction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public MeetingRequest extractMeetingRequirements(InboundEmail email, ExtractedContext context,
                                                     String instructions) {
        int defaultDuration = properties.getBooking().getDefaultDurationMinutes();
        String system = MEETING_PROMPT.formatted(LocalDate.now(clock.withZone(properties.zoneId())), defaultDuration);
        String user = renderEmail(email)
                + "\n\nDetected dates: " + (context == null ? "[]" : context.dates())
                + (instructions == null || instructions.isBlank() ? "" : "\n\nInstructions: " + instructions);
        MeetingRequirements raw;
        try {
            raw = llmService.structuredCall(system, user, MeetingRequirements.class);
        } catch (RuntimeException e) {
            throw new InterpretationException("Meeting requirement extraction failed: " + e.getMessage(), e);
        }
        return new MeetingRequest(
                raw.requested(),
                raw.title() == null || raw.title().isBlank() ? email.subject() : raw.title(),
                parseStart(raw.startIso()),
                raw.durationMinutes() == null || raw.durationMinutes() <= 0 ? defaultDuration : raw.durationMinutes(),
                raw.attendees() == null || raw.attendees().isEmpty() ? List.of(email.sender()) : raw.attendees(),
                raw.notes());
    }

    @Override
    public String composeReply(ComposeContext context) {
        var prompt = new StringBuilder(renderEmail(context.email()));
        if (context.context() != null) {
            prompt.append("\n\nRequested actions: ").append(context.context().requestedActions());
        }
        if (!context.availability().isBlank()) {
            prompt.append("\n\nAvailability: ").append(context.availability());
        }
        if (!context.alternatives().isEmpty()) {
            prompt.append("\nAlternative times: ").append(context.alternatives());
        }
        appendRecords(prompt, "Relevant documents", context.knowledge());
        appendRecords(prompt, "Contact information", context.contacts());
        if (!context.gaps().isEmpty()) {
            prompt.append("\n\nMissing information to acknowledge: ").append(String.join("; ", context.gaps()));
        }
        if (context.isRevision()) {
            prompt.append("\n\nPrevious draft:\n").append(context.previousDraft());
            prompt.append("\n\nReviewer feedback:\n").append(String.join("\n", context.feedback()));
        }
        try {
            return llmService.textCall(COMPOSE_PROMPT, prompt.toString());
        } catch (RuntimeException e) {
            throw new InterpretationException("Reply composition failed: " + e.getMessage(), e);
        }
    }

    private static void appendRecords(StringBuilder prompt, String heading,
                                      List<DirectoryRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        prompt.append("\n\n").append(heading).append(":\n").append(records.stream()
                .map(r -> "- " + r.title() + ": " + r.content())
                .collect(Collectors.joining("\n")));
    }

    private static String renderEmail(InboundEmail email) {
        return "From: " + email.sender() + "\nSubject: " + email.subject() + "\n\n" + email.body();
    }

    private static LocalDateTime parseStart(String iso) {
        if (iso == null || iso.isBlank() || iso.equalsIgnoreCase("null")) {
            return null;
        }
        try {
            return LocalDateTime.parse(iso.trim());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable meeting start '{}'", iso);
            return null;
        }
    }
}
