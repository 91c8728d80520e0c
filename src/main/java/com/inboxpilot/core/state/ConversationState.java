package com.inboxpilot.core.state;

import com.inboxpilot.core.interrupt.InterruptResolution;
import com.inboxpilot.core.interrupt.PendingInterrupt;
import com.inboxpilot.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one email conversation.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every field declares its
 * merge strategy once in {@link #FIELDS}; the graph channels ({@link #SCHEMA}) and
 * {@link ConversationStore} are both derived from it.
 */
public class ConversationState extends AgentState {

    public static final String CONVERSATION_ID = "conversationId";
    public static final String REQUEST = "request";
    public static final String EXTRACTED_CONTEXT = "extractedContext";
    public static final String TASK_DATA = "taskData";
    public static final String DRAFT_OUTPUT = "draftOutput";
    public static final String ROUTING_PLAN = "routingPlan";
    public static final String PENDING_FEEDBACK = "pendingFeedback";
    public static final String STATUS = "status";
    public static final String ERRORS = "errors";
    public static final String EPOCH = "epoch";
    public static final String MESSAGES = "messages";
    public static final String INSIGHTS = "insights";
    public static final String COUNTERS = "counters";
    public static final String FEEDBACK_HISTORY = "feedbackHistory";
    public static final String PENDING_INTERRUPT = "pendingInterrupt";
    public static final String RESOLUTION = "resolution";
    public static final String ENTRY_POINT = "entryPoint";
    public static final String LAST_DECISION = "lastDecision";
    public static final String COMMITTED_EFFECTS = "committedEffects";

    /**
     * Merge strategy and default of one field. A null default means "absent until written".
     */
    public record Field<T>(Reducer<T> reducer, Supplier<T> defaultValue) {}

    public static final Map<String, Field<?>> FIELDS = buildFields();

    public static final Map<String, Channel<?>> SCHEMA = buildSchema();

    public ConversationState(Map<String, Object> initData) {
        super(initData);
    }

    private static Map<String, Field<?>> buildFields() {
        var fields = new LinkedHashMap<String, Field<?>>();
        // ── Scalars ──────────────────────────────────────────────────
        fields.put(CONVERSATION_ID,   new Field<>(StateReducers.<String>firstWins(), null));
        fields.put(REQUEST,           new Field<>(StateReducers.<InboundEmail>firstWins(), null));
        fields.put(EXTRACTED_CONTEXT, new Field<>(StateReducers.<ExtractedContext>firstWins(), null));
        fields.put(DRAFT_OUTPUT,      new Field<>(StateReducers.<String>overwrite(), () -> ""));
        fields.put(ROUTING_PLAN,      new Field<>(StateReducers.<RoutingPlan>overwrite(), null));
        fields.put(PENDING_FEEDBACK,  new Field<>(StateReducers.<String>overwrite(), () -> ""));
        fields.put(STATUS,            new Field<>(StateReducers.<ConversationStatus>overwrite(),
                () -> ConversationStatus.PROCESSING));
        fields.put(EPOCH,             new Field<>(StateReducers.max(), () -> 1));
        fields.put(PENDING_INTERRUPT, new Field<>(StateReducers.<PendingInterrupt>overwrite(), PendingInterrupt::none));
        fields.put(RESOLUTION,        new Field<>(StateReducers.<InterruptResolution>overwrite(), InterruptResolution::none));
        fields.put(ENTRY_POINT,       new Field<>(StateReducers.<EntryPoint>overwrite(), () -> EntryPoint.PARSE));
        fields.put(LAST_DECISION,     new Field<>(StateReducers.<RoutingDecision>overwrite(), null));
        // ── Maps ─────────────────────────────────────────────────────
        fields.put(TASK_DATA,         new Field<>(StateReducers.<StageKind, TaskResult>union(), Map::of));
        fields.put(COMMITTED_EFFECTS, new Field<>(StateReducers.<String, String>union(), Map::of));
        fields.put(COUNTERS,          new Field<>(StateReducers.keywiseMax(), Map::of));
        // ── Append-only collections ──────────────────────────────────
        fields.put(ERRORS,            new Field<>(StateReducers.<StageError>concat(), List::of));
        fields.put(MESSAGES,          new Field<>(StateReducers.<String>concat(), List::of));
        fields.put(FEEDBACK_HISTORY,  new Field<>(StateReducers.<FeedbackEntry>concat(), List::of));
        fields.put(INSIGHTS,          new Field<>(StateReducers.<String>distinctAppend(), List::of));
        return Map.copyOf(fields);
    }

    private static Map<String, Channel<?>> buildSchema() {
        var schema = new LinkedHashMap<String, Channel<?>>();
        FIELDS.forEach((key, field) -> schema.put(key, channel(field)));
        return Map.copyOf(schema);
    }

    private static <T> Channel<T> channel(Field<T> field) {
        return field.defaultValue() == null
                ? Channels.base(field.reducer())
                : Channels.base(field.reducer(), field.defaultValue());
    }

    // ── Accessors ────────────────────────────────────────────────────

    public String conversationId() {
        return this.<String>value(CONVERSATION_ID).orElse("");
    }

    public Optional<InboundEmail> request() {
        return value(REQUEST);
    }

    public Optional<ExtractedContext> extractedContext() {
        return value(EXTRACTED_CONTEXT);
    }

    public Map<StageKind, TaskResult> taskData() {
        return this.<Map<StageKind, TaskResult>>value(TASK_DATA).orElse(Map.of());
    }

    public Optional<TaskResult> taskResult(StageKind stage) {
        return Optional.ofNullable(taskData().get(stage));
    }

    public CompletionMarker marker(StageKind stage) {
        return taskResult(stage).map(TaskResult::marker).orElse(CompletionMarker.PENDING);
    }

    public String draftOutput() {
        return this.<String>value(DRAFT_OUTPUT).orElse("");
    }

    public Optional<RoutingPlan> routingPlan() {
        return value(ROUTING_PLAN);
    }

    public String pendingFeedback() {
        return this.<String>value(PENDING_FEEDBACK).orElse("");
    }

    public boolean hasPendingFeedback() {
        return !pendingFeedback().isBlank();
    }

    public ConversationStatus status() {
        return this.<ConversationStatus>value(STATUS).orElse(ConversationStatus.PROCESSING);
    }

    public List<StageError> errors() {
        return this.<List<StageError>>value(ERRORS).orElse(List.of());
    }

    public int epoch() {
        return this.<Integer>value(EPOCH).orElse(1);
    }

    public List<String> messages() {
        return this.<List<String>>value(MESSAGES).orElse(List.of());
    }

    public List<String> insights() {
        return this.<List<String>>value(INSIGHTS).orElse(List.of());
    }

    public Map<String, Integer> counters() {
        return this.<Map<String, Integer>>value(COUNTERS).orElse(Map.of());
    }

    public int counter(String name) {
        return counters().getOrDefault(name, 0);
    }

    public List<FeedbackEntry> feedbackHistory() {
        return this.<List<FeedbackEntry>>value(FEEDBACK_HISTORY).orElse(List.of());
    }

    public PendingInterrupt pendingInterrupt() {
        return this.<PendingInterrupt>value(PENDING_INTERRUPT).orElse(PendingInterrupt.none());
    }

    public InterruptResolution resolution() {
        return this.<InterruptResolution>value(RESOLUTION).orElse(InterruptResolution.none());
    }

    public EntryPoint entryPoint() {
        return this.<EntryPoint>value(ENTRY_POINT).orElse(EntryPoint.PARSE);
    }

    public Optional<RoutingDecision> lastDecision() {
        return value(LAST_DECISION);
    }

    public Map<String, String> committedEffects() {
        return this.<Map<String, String>>value(COMMITTED_EFFECTS).orElse(Map.of());
    }

    /** Idempotency key of a side effect for the current epoch. */
    public String effectKey(String stage) {
        return conversationId() + ":" + epoch() + ":" + stage;
    }
}
