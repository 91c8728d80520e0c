package com.inboxpilot.core.engine;

import com.inboxpilot.core.events.EventBus;
import com.inboxpilot.core.events.InboxEvent;
import com.inboxpilot.core.graph.InboxGraph;
import com.inboxpilot.core.interrupt.HumanResponse;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.interrupt.InterruptResolution;
import com.inboxpilot.core.logging.MdcContext;
import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.nodes.ErrorReviewNode;
import com.inboxpilot.core.persistence.ConversationSnapshot;
import com.inboxpilot.core.persistence.ConversationSnapshotStore;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.core.state.ConversationStore;
import com.inboxpilot.core.state.StatusTransitions;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs conversations through the {@link InboxGraph} and owns their persistence.
 * <p>
 * Every run starts from a snapshot (or a fresh state), ends at an interrupt boundary or a
 * terminal status, and is saved before control returns. Resumes for the same conversation are
 * serialized; a second response to an already-resolved interrupt is refused. A run that fails
 * outside any stage still ends at an error review, so every non-terminal conversation is
 * waiting on someone.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final InboxGraph inboxGraph;
    private final ConversationStore store;
    private final ConversationSnapshotStore snapshots;
    private final InterruptController interruptController;
    private final ErrorReviewNode errorReview;
    private final EventBus eventBus;
    private final InboxMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ConversationEngine(InboxGraph inboxGraph,
                              ConversationStore store,
                              ConversationSnapshotStore snapshots,
                              InterruptController interruptController,
                              ErrorReviewNode errorReview,
                              EventBus eventBus,
                              InboxMetrics metrics,
                              Clock clock) {
        this.inboxGraph = inboxGraph;
        this.store = store;
        this.snapshots = snapshots;
        this.interruptController = interruptController;
        this.errorReview = errorReview;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ConversationSnapshot start(InboundEmail email) {
        return start(generateConversationId(), email);
    }

    /**
     * Processes a new request until the first interrupt or a terminal status.
     *
     * @param conversationId id to use (e.g. pre-generated by the REST controller)
     * @param email          the inbound request
     * @throws DuplicateConversationException when a conversation with this id exists
     */
    public ConversationSnapshot start(String conversationId, InboundEmail email) {
        return withLock(conversationId, () -> {
            MdcContext.setConversation(conversationId, 1);
            try {
                if (snapshots.load(conversationId).isPresent()) {
                    throw new DuplicateConversationException(conversationId);
                }
                log.info("Starting conversation {} for message from {}: {}",
                        conversationId, email.sender(), email.subject());
                publish(InboxEvent.STARTED, conversationId, null, payload(
                        "sender", email.sender(), "subject", email.subject()));

                var input = store.initial();
                input.put(ConversationState.CONVERSATION_ID, conversationId);
                input.put(ConversationState.REQUEST, email);
                return run(conversationId, input, null);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Applies a human response to a suspended conversation and continues it.
     *
     * @throws ConversationNotFoundException when the id is unknown
     * @throws NotAwaitingInputException     when nothing is pending
     * @throws IllegalArgumentException      when the response does not fit the pending request
     */
    public ConversationSnapshot resume(String conversationId, HumanResponse response) {
        return withLock(conversationId, () -> {
            var before = snapshots.load(conversationId)
                    .orElseThrow(() -> new ConversationNotFoundException(conversationId));
            MdcContext.setConversation(conversationId, before.epoch());
            try {
                if (!before.isAwaitingInput()) {
                    throw new NotAwaitingInputException(conversationId, before.status().name());
                }
                InterruptResolution resolution = interruptController.resolve(before.pendingInterrupt(), response);
                log.info("Resuming conversation {} at {} with {}", conversationId,
                        before.pendingInterrupt().point(), resolution.kind());
                publish(InboxEvent.RESUMED, conversationId, resolution.point().name(), payload(
                        "resolution", resolution.kind().name(), "epoch", before.epoch()));
                return continueWith(conversationId, before, resolution);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Resolves every interrupt whose deadline has passed as "no response".
     *
     * @return number of conversations expired
     */
    public int expireOverdue() {
        int expired = 0;
        for (ConversationSnapshot candidate : snapshots.findAwaiting()) {
            if (!candidate.pendingInterrupt().isExpired(clock.instant())) {
                continue;
            }
            String id = candidate.conversationId();
            boolean done = withLock(id, () -> {
                var current = snapshots.load(id).orElse(null);
                if (current == null || !current.isAwaitingInput()
                        || !current.pendingInterrupt().isExpired(clock.instant())) {
                    return false;
                }
                MdcContext.setConversation(id, current.epoch());
                try {
                    log.info("Interrupt {} of conversation {} expired at {}",
                            current.pendingInterrupt().point(), id, current.pendingInterrupt().deadline());
                    continueWith(id, current, interruptController.timeout(current.pendingInterrupt()));
                    return true;
                } finally {
                    MdcContext.clear();
                }
            });
            if (done) {
                expired++;
            }
        }
        return expired;
    }

    public Optional<ConversationSnapshot> get(String conversationId) {
        return snapshots.load(conversationId);
    }

    public List<ConversationSnapshot> listAwaiting() {
        return snapshots.findAwaiting();
    }

    /**
     * Generates a conversation ID in the format CONV-YYYY-XXXXXXXXXXXX (12 random hex digits),
     * unique across processes sharing one snapshot store.
     */
    public String generateConversationId() {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase();
        return String.format("CONV-%d-%s", year, random);
    }

    int lockCount() {
        return locks.size();
    }

    private ConversationSnapshot continueWith(String conversationId, ConversationSnapshot before,
                                              InterruptResolution resolution) {
        var state = new ConversationState(before.toStateMap());
        var plan = interruptController.resumePlan(state, resolution);
        StatusTransitions.check("resume", state, plan.update());
        var resumed = store.apply(before.toStateMap(), plan.update());
        if (plan.runGraph()) {
            return run(conversationId, resumed, before);
        }
        return persist(conversationId, new ConversationState(resumed), before);
    }

    private ConversationSnapshot run(String conversationId, Map<String, Object> input, ConversationSnapshot before) {
        var config = RunnableConfig.builder()
                .threadId(conversationId)
                .build();
        ConversationState result;
        try {
            result = inboxGraph.getCompiledGraph()
                    .invoke(input, config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for conversation " + conversationId));
        } catch (RuntimeException e) {
            log.error("Graph run failed for conversation {}", conversationId, e);
            var failure = new HashMap<String, Object>();
            failure.put(ConversationState.STATUS, ConversationStatus.ERROR);
            failure.put(ConversationState.ERRORS, List.of(new StageError("engine", ErrorKind.FATAL,
                    e.getClass().getSimpleName() + ": " + e.getMessage())));
            var failed = store.apply(input, failure);
            result = new ConversationState(store.apply(failed, errorReview.apply(new ConversationState(failed))));
        }
        return persist(conversationId, result, before);
    }

    private ConversationSnapshot persist(String conversationId, ConversationState state, ConversationSnapshot before) {
        var snapshot = ConversationSnapshot.of(state, clock.instant());
        snapshots.save(snapshot);
        publishEffects(conversationId, snapshot, before);
        metrics.recordConversationResult(snapshot.status().name());

        if (snapshot.isAwaitingInput()) {
            var pending = snapshot.pendingInterrupt();
            log.info("Conversation {} suspended at {} (epoch {})", conversationId, pending.point(), snapshot.epoch());
            publish(InboxEvent.INTERRUPT_RAISED, conversationId, pending.point().name(), payload(
                    "action", pending.request().action(), "epoch", pending.epoch()));
        }
        if (snapshot.status().isTerminal()) {
            var archivedAt = clock.instant();
            snapshots.archive(conversationId, archivedAt);
            locks.remove(conversationId);
            log.info("Conversation {} archived with status {}", conversationId, snapshot.status());
            publish(InboxEvent.ARCHIVED, conversationId, null, payload("status", snapshot.status().name()));
            return snapshot.archive(archivedAt);
        }
        return snapshot;
    }

    private void publishEffects(String conversationId, ConversationSnapshot after, ConversationSnapshot before) {
        Map<String, String> previous = before == null ? Map.of() : before.committedEffects();
        after.committedEffects().forEach((key, result) -> {
            if (previous.containsKey(key)) {
                return;
            }
            if (key.endsWith(":send")) {
                publish(InboxEvent.REPLY_SENT, conversationId, "send", payload("key", key, "messageId", result));
            } else if (key.endsWith(":book")) {
                publish(InboxEvent.EVENT_BOOKED, conversationId, "scheduling", payload("key", key, "eventId", result));
            }
        });
    }

    private void publish(String type, String conversationId, String stage, Map<String, Object> payload) {
        eventBus.publish(new InboxEvent(type, conversationId, stage, payload, clock.instant()));
    }

    private static Map<String, Object> payload(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1] == null ? "" : keyValues[i + 1]);
        }
        return map;
    }

    private <T> T withLock(String conversationId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(conversationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
