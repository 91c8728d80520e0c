package com.inboxpilot.core.booking;

import com.inboxpilot.core.interrupt.ResolutionKind;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Nested booking workflow run by the scheduling stage.
 * <pre>
 *   START -> [decision present?]
 *            -> analyze_availability -> [route] -> book_review | END
 *            -> book_review -> [route] -> book -> END
 *                                      -> END   (awaiting approval or declined)
 * </pre>
 * The first pass stops at {@code book_review} with an interrupt. The resumed pass starts there
 * with the reviewer's decision and the outcome stored from the first pass.
 */
@Component
public class BookingGraph {

    /** Final state of one sub-graph run. */
    public record Result(SchedulingOutcome outcome, BookingState state) {}

    private final CompiledGraph<BookingState> compiledGraph;

    public BookingGraph(AnalyzeAvailabilityNode analyzeNode,
                        BookingReviewNode reviewNode,
                        BookEventNode bookNode) throws GraphStateException {
        var graph = new StateGraph<>(BookingState.SCHEMA, BookingState::new)
                .addNode("analyze_availability", node_async(analyzeNode::apply))
                .addNode("book_review", node_async(reviewNode::apply))
                .addNode("book", node_async(bookNode::apply))
                .addConditionalEdges(START,
                        edge_async(state -> state.hasDecision() ? "book_review" : "analyze_availability"),
                        Map.of("book_review", "book_review",
                                "analyze_availability", "analyze_availability"))
                .addConditionalEdges("analyze_availability",
                        edge_async(BookingState::route),
                        Map.of(BookingState.ROUTE_REVIEW, "book_review",
                                BookingState.ROUTE_EXIT, END))
                .addConditionalEdges("book_review",
                        edge_async(BookingState::route),
                        Map.of(BookingState.ROUTE_BOOK, "book",
                                BookingState.ROUTE_EXIT, END))
                .addEdge("book", END);
        this.compiledGraph = graph.compile(CompileConfig.builder().build());
    }

    /** First pass: availability check, possibly ending in a booking interrupt. */
    public Result analyze(String conversationId, int epoch, MeetingRequest meeting, String task) {
        var input = new HashMap<String, Object>();
        input.put(BookingState.CONVERSATION_ID, conversationId);
        input.put(BookingState.EPOCH, epoch);
        input.put(BookingState.MEETING, meeting);
        input.put(BookingState.TASK, task);
        return run(conversationId, input);
    }

    /** Resumed pass: applies the reviewer's decision to the stored outcome. */
    public Result decide(String conversationId, int epoch, SchedulingOutcome stored, ResolutionKind decision) {
        var input = new HashMap<String, Object>();
        input.put(BookingState.CONVERSATION_ID, conversationId);
        input.put(BookingState.EPOCH, epoch);
        input.put(BookingState.MEETING, stored.meeting());
        input.put(BookingState.OUTCOME, stored);
        input.put(BookingState.DECISION, decision);
        return run(conversationId, input);
    }

    private Result run(String conversationId, Map<String, Object> input) {
        var config = RunnableConfig.builder()
                .threadId(conversationId + ":booking")
                .build();
        BookingState state = compiledGraph.invoke(input, config)
                .orElseThrow(() -> new IllegalStateException(
                        "Booking workflow returned empty state for conversation " + conversationId));
        return new Result(state.outcome(), state);
    }
}
