package com.inboxpilot.core.graph;

import com.inboxpilot.core.interrupt.ActionRequest;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.interrupt.PendingInterrupt;
import com.inboxpilot.core.model.*;
import com.inboxpilot.core.nodes.*;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.core.state.ConversationStore;
import org.bsc.langgraph4j.RunnableConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Graph topology with every node mocked.
 */
class InboxGraphTest {

    private ParseRequestNode parseNode;
    private SupervisorNode supervisorNode;
    private SchedulingNode schedulingNode;
    private KnowledgeLookupNode knowledgeNode;
    private ContactLookupNode contactNode;
    private ComposeResponseNode composeNode;
    private ReviewDraftNode reviewNode;
    private SendReplyNode sendNode;
    private ErrorReviewNode errorReviewNode;
    private InboxGraph inboxGraph;

    @BeforeEach
    void setUp() throws Exception {
        parseNode = mock(ParseRequestNode.class);
        supervisorNode = mock(SupervisorNode.class);
        schedulingNode = mock(SchedulingNode.class);
        knowledgeNode = mock(KnowledgeLookupNode.class);
        contactNode = mock(ContactLookupNode.class);
        composeNode = mock(ComposeResponseNode.class);
        reviewNode = mock(ReviewDraftNode.class);
        sendNode = mock(SendReplyNode.class);
        errorReviewNode = mock(ErrorReviewNode.class);

        when(parseNode.apply(any())).thenReturn(Map.of(ConversationState.MESSAGES, List.of("parse")));
        // Routes to contact until it has a result, then to compose.
        when(supervisorNode.apply(any())).thenAnswer(invocation -> {
            ConversationState state = invocation.getArgument(0);
            StageKind next = state.taskResult(StageKind.CONTACT).isPresent() ? StageKind.COMPOSE : StageKind.CONTACT;
            return Map.of(
                    ConversationState.LAST_DECISION, new RoutingDecision(next, "", 1.0, false, 1),
                    ConversationState.MESSAGES, List.of("router:" + next.wireName()));
        });
        when(contactNode.apply(any())).thenReturn(Map.of(
                ConversationState.TASK_DATA, Map.of(StageKind.CONTACT,
                        TaskResult.success(StageKind.CONTACT, "", "found", List.of(), 1)),
                ConversationState.MESSAGES, List.of("contact")));
        when(composeNode.apply(any())).thenReturn(Map.of(
                ConversationState.DRAFT_OUTPUT, "draft",
                ConversationState.MESSAGES, List.of("compose")));
        when(reviewNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.AWAITING_REVIEW,
                ConversationState.MESSAGES, List.of("review")));
        when(sendNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.COMPLETED,
                ConversationState.MESSAGES, List.of("send")));
        when(errorReviewNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.ERROR,
                ConversationState.MESSAGES, List.of("error review")));

        inboxGraph = new InboxGraph(parseNode, supervisorNode, schedulingNode, knowledgeNode, contactNode,
                composeNode, reviewNode, sendNode, errorReviewNode);
    }

    private ConversationState run(EntryPoint entryPoint) {
        return run(entryPoint, entryPoint == EntryPoint.SEND ? ConversationStatus.APPROVED : ConversationStatus.PROCESSING);
    }

    private ConversationState run(EntryPoint entryPoint, ConversationStatus status) {
        var input = new ConversationStore().initial();
        input.put(ConversationState.CONVERSATION_ID, "CONV-1");
        input.put(ConversationState.ENTRY_POINT, entryPoint);
        input.put(ConversationState.STATUS, status);
        return inboxGraph.getCompiledGraph()
                .invoke(input, RunnableConfig.builder().threadId("CONV-1").build())
                .orElseThrow();
    }

    private static PendingInterrupt bookingInterrupt() {
        var request = new ActionRequest("Book: Sync", Map.of(), true, true, true, false, 300);
        return new PendingInterrupt(InterruptPoint.BOOKING_REVIEW, request, 1, Instant.EPOCH, null);
    }

    @Test
    @DisplayName("a fresh run parses, routes through workers and stops at draft review")
    void freshRunStopsAtReview() {
        var result = run(EntryPoint.PARSE);

        assertEquals(List.of("parse", "router:contact", "contact", "router:compose", "compose", "review"),
                result.messages());
        assertEquals(ConversationStatus.AWAITING_REVIEW, result.status());
        verifyNoInteractions(sendNode, schedulingNode, knowledgeNode);
    }

    @Test
    @DisplayName("an approved draft enters at send and runs nothing else")
    void sendEntry() {
        var result = run(EntryPoint.SEND);

        assertEquals(List.of("send"), result.messages());
        verifyNoInteractions(parseNode, supervisorNode, composeNode, reviewNode, errorReviewNode);
    }

    @Test
    @DisplayName("a failed send goes to error review instead of ending")
    void failedSendRaisesErrorReview() {
        when(sendNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.ERROR,
                ConversationState.MESSAGES, List.of("send failed")));

        var result = run(EntryPoint.SEND);

        assertEquals(List.of("send failed", "error review"), result.messages());
    }

    @Test
    @DisplayName("a compose crash goes to error review, never to draft review")
    void composeErrorSkipsReview() {
        when(composeNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.ERROR,
                ConversationState.MESSAGES, List.of("compose crashed")));

        var result = run(EntryPoint.PARSE);

        assertEquals("error review", result.messages().get(result.messages().size() - 1));
        assertEquals(ConversationStatus.ERROR, result.status());
        verifyNoInteractions(reviewNode);
    }

    @Test
    @DisplayName("a blank draft is not offered for review")
    void blankDraftSkipsReview() {
        when(composeNode.apply(any())).thenReturn(Map.of(ConversationState.MESSAGES, List.of("compose")));

        run(EntryPoint.PARSE);

        verify(errorReviewNode).apply(any());
        verifyNoInteractions(reviewNode);
    }

    @Test
    @DisplayName("a worker leaving the conversation in ERROR is routed to error review by the supervisor")
    void workerErrorRaisesErrorReview() {
        when(contactNode.apply(any())).thenReturn(Map.of(
                ConversationState.STATUS, ConversationStatus.ERROR,
                ConversationState.MESSAGES, List.of("contact crashed")));

        var result = run(EntryPoint.PARSE);

        assertEquals("error review", result.messages().get(result.messages().size() - 1));
        verifyNoInteractions(composeNode, reviewNode);
    }

    @Test
    @DisplayName("a node moving the status along an edge the status machine lacks fails the run")
    void illegalTransitionRejected() {
        var thrown = assertThrows(RuntimeException.class, () -> run(EntryPoint.SEND, ConversationStatus.ERROR));

        Throwable cause = thrown;
        while (!(cause instanceof IllegalStateException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        assertInstanceOf(IllegalStateException.class, cause);
        assertTrue(cause.getMessage().contains("from ERROR to COMPLETED"), cause.getMessage());
    }

    @Test
    @DisplayName("a router FINISH ends the run without composing")
    void finish() {
        when(supervisorNode.apply(any())).thenReturn(Map.of(
                ConversationState.LAST_DECISION, RoutingDecision.finish("done", 1)));

        run(EntryPoint.ROUTER);

        verifyNoInteractions(parseNode, composeNode, reviewNode);
    }

    @Test
    @DisplayName("a booking interrupt from scheduling suspends the run before the router")
    void bookingInterruptSuspends() {
        when(schedulingNode.apply(any())).thenReturn(Map.of(
                ConversationState.PENDING_INTERRUPT, bookingInterrupt(),
                ConversationState.MESSAGES, List.of("scheduling")));

        var result = run(EntryPoint.SCHEDULING);

        assertEquals(List.of("scheduling", "scheduling: awaiting booking approval"), result.messages());
        assertTrue(result.pendingInterrupt().isActive());
        verifyNoInteractions(supervisorNode);
    }

    @Test
    @DisplayName("scheduling without an interrupt reports back to the router")
    void schedulingReportsBack() {
        when(schedulingNode.apply(any())).thenReturn(Map.of(ConversationState.MESSAGES, List.of("scheduling")));

        var result = run(EntryPoint.SCHEDULING);

        assertEquals("scheduling", result.messages().get(0));
        assertEquals("review", result.messages().get(result.messages().size() - 1));
    }

    @ParameterizedTest
    @EnumSource(EntryPoint.class)
    @DisplayName("every entry point maps to a graph node")
    void routeEntry(EntryPoint entryPoint) {
        var state = new ConversationState(Map.of(ConversationState.ENTRY_POINT, entryPoint));

        String node = InboxGraph.routeEntry(state);

        assertTrue(List.of(InboxGraph.PARSE, InboxGraph.SUPERVISOR, InboxGraph.SCHEDULING, InboxGraph.SEND)
                .contains(node));
    }

    @Test
    @DisplayName("route after scheduling depends only on the pending interrupt")
    void routeAfterScheduling() {
        assertEquals(InboxGraph.SUPERVISOR, InboxGraph.routeAfterScheduling(new ConversationState(Map.of())));
        assertEquals(InboxGraph.AWAIT_BOOKING, InboxGraph.routeAfterScheduling(new ConversationState(Map.of(
                ConversationState.PENDING_INTERRUPT, bookingInterrupt()))));
    }

    @Test
    @DisplayName("route after compose needs a draft and a healthy status")
    void routeAfterCompose() {
        assertEquals(InboxGraph.REVIEW, InboxGraph.routeAfterCompose(new ConversationState(Map.of(
                ConversationState.DRAFT_OUTPUT, "draft"))));
        assertEquals(InboxGraph.REVIEW_ERROR, InboxGraph.routeAfterCompose(new ConversationState(Map.of())));
        assertEquals(InboxGraph.REVIEW_ERROR, InboxGraph.routeAfterCompose(new ConversationState(Map.of(
                ConversationState.DRAFT_OUTPUT, "draft",
                ConversationState.STATUS, ConversationStatus.ERROR))));
    }
}
