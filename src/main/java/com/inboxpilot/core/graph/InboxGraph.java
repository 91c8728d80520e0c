package com.inboxpilot.core.graph;

import com.inboxpilot.core.nodes.ComposeResponseNode;
import com.inboxpilot.core.nodes.ContactLookupNode;
import com.inboxpilot.core.nodes.ErrorReviewNode;
import com.inboxpilot.core.nodes.KnowledgeLookupNode;
import com.inboxpilot.core.nodes.ParseRequestNode;
import com.inboxpilot.core.nodes.ReviewDraftNode;
import com.inboxpilot.core.nodes.SchedulingNode;
import com.inboxpilot.core.nodes.SendReplyNode;
import com.inboxpilot.core.nodes.SupervisorNode;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.core.state.StatusTransitions;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one conversation run.
 * <pre>
 *   START -> [entryPoint]
 *         -> parse_request -> supervisor
 *         -> supervisor -> [next] -> scheduling | knowledge_lookup | contact_lookup -> supervisor
 *                                 -> compose_response -> [draft?] -> review_draft -> END  (draft interrupt)
 *                                                                 -> review_error -> END  (error interrupt)
 *                                 -> review_error -> END                                  (status ERROR)
 *                                 -> END                                                  (finish)
 *         -> scheduling -> [booking interrupt?] -> await_booking -> END
 *                                               -> supervisor
 *         -> send_reply -> [status ERROR?] -> review_error -> END
 *                                          -> END
 * </pre>
 * A run always ends at an interrupt boundary or a terminal status. Resumed runs enter at the
 * router, at scheduling (booking decision) or at send_reply (approved draft).
 * <p>
 * Every node's STATUS update is checked by {@link StatusTransitions} before it is merged.
 */
@Component
public class InboxGraph {

    private static final Logger log = LoggerFactory.getLogger(InboxGraph.class);

    static final String PARSE = "parse_request";
    static final String SUPERVISOR = "supervisor";
    static final String SCHEDULING = "scheduling";
    static final String KNOWLEDGE = "knowledge_lookup";
    static final String CONTACT = "contact_lookup";
    static final String COMPOSE = "compose_response";
    static final String REVIEW = "review_draft";
    static final String AWAIT_BOOKING = "await_booking";
    static final String SEND = "send_reply";
    static final String REVIEW_ERROR = "review_error";

    private final CompiledGraph<ConversationState> compiledGraph;

    public InboxGraph(ParseRequestNode parseNode,
                      SupervisorNode supervisorNode,
                      SchedulingNode schedulingNode,
                      KnowledgeLookupNode knowledgeNode,
                      ContactLookupNode contactNode,
                      ComposeResponseNode composeNode,
                      ReviewDraftNode reviewNode,
                      SendReplyNode sendNode,
                      ErrorReviewNode errorReviewNode) throws GraphStateException {

        var graph = new StateGraph<>(ConversationState.SCHEMA, ConversationState::new)
                .addNode(PARSE, node_async(guarded(PARSE, parseNode::apply)))
                .addNode(SUPERVISOR, node_async(guarded(SUPERVISOR, supervisorNode::apply)))
                .addNode(SCHEDULING, node_async(guarded(SCHEDULING, schedulingNode::apply)))
                .addNode(KNOWLEDGE, node_async(guarded(KNOWLEDGE, knowledgeNode::apply)))
                .addNode(CONTACT, node_async(guarded(CONTACT, contactNode::apply)))
                .addNode(COMPOSE, node_async(guarded(COMPOSE, composeNode::apply)))
                .addNode(REVIEW, node_async(guarded(REVIEW, reviewNode::apply)))
                .addNode(AWAIT_BOOKING, node_async(
                        state -> Map.of(ConversationState.MESSAGES, List.of("scheduling: awaiting booking approval"))))
                .addNode(SEND, node_async(guarded(SEND, sendNode::apply)))
                .addNode(REVIEW_ERROR, node_async(guarded(REVIEW_ERROR, errorReviewNode::apply)))
                .addConditionalEdges(START,
                        edge_async(InboxGraph::routeEntry),
                        Map.of(PARSE, PARSE,
                                SUPERVISOR, SUPERVISOR,
                                SCHEDULING, SCHEDULING,
                                SEND, SEND))
                .addEdge(PARSE, SUPERVISOR)
                .addConditionalEdges(SUPERVISOR,
                        edge_async(SupervisorNode::route),
                        Map.of(SCHEDULING, SCHEDULING,
                                KNOWLEDGE, KNOWLEDGE,
                                CONTACT, CONTACT,
                                COMPOSE, COMPOSE,
                                SupervisorNode.ERROR_ROUTE, REVIEW_ERROR,
                                "FINISH", END))
                .addConditionalEdges(SCHEDULING,
                        edge_async(InboxGraph::routeAfterScheduling),
                        Map.of(AWAIT_BOOKING, AWAIT_BOOKING,
                                SUPERVISOR, SUPERVISOR))
                .addEdge(AWAIT_BOOKING, END)
                .addEdge(KNOWLEDGE, SUPERVISOR)
                .addEdge(CONTACT, SUPERVISOR)
                .addConditionalEdges(COMPOSE,
                        edge_async(InboxGraph::routeAfterCompose),
                        Map.of(REVIEW, REVIEW,
                                REVIEW_ERROR, REVIEW_ERROR))
                .addEdge(REVIEW, END)
                .addConditionalEdges(SEND,
                        edge_async(InboxGraph::routeAfterSend),
                        Map.of(REVIEW_ERROR, REVIEW_ERROR,
                                END, END))
                .addEdge(REVIEW_ERROR, END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Conversation graph compiled; snapshots are persisted by the engine");
    }

    static String routeEntry(ConversationState state) {
        return switch (state.entryPoint()) {
            case PARSE -> PARSE;
            case ROUTER -> SUPERVISOR;
            case SCHEDULING -> SCHEDULING;
            case SEND -> SEND;
        };
    }

    /** A booking interrupt suspends the run; anything else reports back to the router. */
    static String routeAfterScheduling(ConversationState state) {
        return state.pendingInterrupt().isActive() ? AWAIT_BOOKING : SUPERVISOR;
    }

    /** Only a non-blank draft of a healthy conversation goes to review. */
    static String routeAfterCompose(ConversationState state) {
        if (state.status() == ConversationStatus.ERROR || state.draftOutput().isBlank()) {
            return REVIEW_ERROR;
        }
        return REVIEW;
    }

    static String routeAfterSend(ConversationState state) {
        return state.status() == ConversationStatus.ERROR ? REVIEW_ERROR : END;
    }

    private static NodeAction<ConversationState> guarded(String node, NodeAction<ConversationState> action) {
        return state -> {
            Map<String, Object> update = action.apply(state);
            StatusTransitions.check(node, state, update);
            return update;
        };
    }

    public CompiledGraph<ConversationState> getCompiledGraph() {
        return compiledGraph;
    }
}
