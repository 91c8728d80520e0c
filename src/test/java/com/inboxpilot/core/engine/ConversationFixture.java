package com.inboxpilot.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.booking.AlternativeSlotPlanner;
import com.inboxpilot.core.booking.AnalyzeAvailabilityNode;
import com.inboxpilot.core.booking.BookEventNode;
import com.inboxpilot.core.booking.BookingGraph;
import com.inboxpilot.core.booking.BookingReviewNode;
import com.inboxpilot.core.booking.ConflictDetector;
import com.inboxpilot.core.events.EventBus;
import com.inboxpilot.core.events.InboxEvent;
import com.inboxpilot.core.graph.InboxGraph;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.nodes.*;
import com.inboxpilot.core.persistence.InMemoryConversationSnapshotStore;
import com.inboxpilot.core.persistence.InMemorySideEffectLedger;
import com.inboxpilot.core.routing.BookingRouteClassifier;
import com.inboxpilot.core.routing.FeedbackClassifier;
import com.inboxpilot.core.routing.StagePlanClassifier;
import com.inboxpilot.core.state.ConversationStore;
import com.inboxpilot.integration.ClassificationPrompt;
import com.inboxpilot.integration.ClassificationService;
import com.inboxpilot.integration.ComposeContext;
import com.inboxpilot.integration.MailTransmissionException;
import com.inboxpilot.integration.MessageInterpreter;
import com.inboxpilot.integration.local.InMemoryCalendarService;
import com.inboxpilot.integration.local.InMemoryContactDirectory;
import com.inboxpilot.integration.local.InMemoryDocumentRepository;
import com.inboxpilot.integration.local.RecordingMailTransmissionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.GraphStateException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Wires a complete engine with in-memory integrations, a scripted classifier and a scripted
 * interpreter. Tests set the JSON each classification purpose answers with.
 */
class ConversationFixture {

    static final Instant NOW = Instant.parse("2025-03-03T08:00:00Z");
    static final LocalDateTime TUESDAY_TEN = LocalDateTime.of(2025, 3, 4, 10, 0);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    final MutableClock clock = new MutableClock(NOW);
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final InboxProperties properties = new InboxProperties();
    final InMemoryCalendarService calendar;
    final InMemoryContactDirectory contacts = new InMemoryContactDirectory();
    final InMemoryDocumentRepository documents = new InMemoryDocumentRepository();
    final FlakyMail mail = new FlakyMail();
    final InMemoryConversationSnapshotStore snapshots;
    final ClassificationService classification = mock(ClassificationService.class);
    final MessageInterpreter interpreter = mock(MessageInterpreter.class);
    final List<InboxEvent> events = new CopyOnWriteArrayList<>();
    final List<ComposeContext> composeContexts = new CopyOnWriteArrayList<>();
    final ConversationEngine engine;

    String stagePlanJson = "{\"execution_plan\": [\"compose\"], \"rationale\": \"simple reply\", \"confidence\": 0.9}";
    String feedbackJson = "{\"domain\": \"response-only\", \"decisions\": [\"modified\"], \"instructions\": \"\"}";
    String bookingJson = "{\"route\": \"review\", \"confidence\": 0.9, \"detected_conflicts\": []}";
    ExtractedContext context = new ExtractedContext(List.of("Sam"), List.of(), List.of("reply"), "medium", "neutral", false);
    MeetingRequest meeting = MeetingRequest.none();
    RuntimeException contextFailure;
    RuntimeException composeFailure;

    ConversationFixture(CalendarEvent... existingEvents) throws GraphStateException {
        this(new InMemoryConversationSnapshotStore(), existingEvents);
    }

    /** Engine over an existing store, as a second process sharing the database would see it. */
    ConversationFixture(InMemoryConversationSnapshotStore snapshots, CalendarEvent... existingEvents)
            throws GraphStateException {
        this.snapshots = snapshots;
        calendar = new InMemoryCalendarService(List.of(existingEvents));
        var metrics = new InboxMetrics(registry);
        var interrupts = new InterruptController(clock, metrics);
        var ledger = new InMemorySideEffectLedger();
        var executor = new StageExecutor(metrics);
        var errorReview = new ErrorReviewNode(interrupts, properties);

        when(classification.classify(any())).thenAnswer(invocation -> {
            ClassificationPrompt prompt = invocation.getArgument(0);
            switch (prompt.purpose()) {
                case STAGE_ROUTING:
                    return json(stagePlanJson);
                case FEEDBACK_ROUTING:
                    return json(feedbackJson);
                default:
                    return json(bookingJson);
            }
        });
        when(interpreter.extractContext(any())).thenAnswer(invocation -> {
            if (contextFailure != null) {
                throw contextFailure;
            }
            return context;
        });
        when(interpreter.extractMeetingRequirements(any(), any(), any())).thenAnswer(invocation -> meeting);
        when(interpreter.composeReply(any())).thenAnswer(invocation -> {
            ComposeContext compose = invocation.getArgument(0);
            if (composeFailure != null) {
                throw composeFailure;
            }
            composeContexts.add(compose);
            var draft = new StringBuilder("Hi Sam, thanks for reaching out.");
            if (!compose.availability().isBlank()) {
                draft.append(' ').append(compose.availability());
            }
            if (compose.isRevision()) {
                draft.append(" (revised: ").append(String.join("; ", compose.feedback())).append(')');
            }
            return draft.toString();
        });

        var bookingGraph = new BookingGraph(
                new AnalyzeAvailabilityNode(calendar, new ConflictDetector(), new AlternativeSlotPlanner(properties),
                        new BookingRouteClassifier(classification)),
                new BookingReviewNode(interrupts, properties),
                new BookEventNode(calendar, ledger, metrics));
        var inboxGraph = new InboxGraph(
                new ParseRequestNode(interpreter),
                new SupervisorNode(new StagePlanClassifier(classification), new FeedbackClassifier(classification), metrics),
                new SchedulingNode(interpreter, bookingGraph, executor),
                new KnowledgeLookupNode(documents, executor),
                new ContactLookupNode(contacts, executor),
                new ComposeResponseNode(interpreter, executor),
                new ReviewDraftNode(interrupts, properties),
                new SendReplyNode(mail, ledger, metrics),
                errorReview);

        var eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        engine = new ConversationEngine(inboxGraph, new ConversationStore(), snapshots, interrupts, errorReview,
                eventBus, metrics, clock);
    }

    List<String> eventTypes() {
        var types = new ArrayList<String>();
        events.forEach(event -> types.add(event.eventType()));
        return types;
    }

    private static Object json(String text) throws JsonProcessingException {
        return MAPPER.readTree(text);
    }

    /** Recording transport that can be taken down. */
    static class FlakyMail extends RecordingMailTransmissionService {

        volatile boolean down;

        @Override
        public String send(String to, String subject, String body, String threadId) {
            if (down) {
                throw new MailTransmissionException("smtp relay unreachable");
            }
            return super.send(to, subject, body, threadId);
        }
    }
}
