package com.inboxpilot.core.nodes;

import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.*;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.DirectoryException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StageExecutorTest {

    private SimpleMeterRegistry registry;
    private StageExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        executor = new StageExecutor(new InboxMetrics(registry));
    }

    private static StageWorker worker(StageKind kind) {
        StageWorker worker = mock(StageWorker.class);
        when(worker.kind()).thenReturn(kind);
        return worker;
    }

    private static ConversationState state(Map<StageKind, TaskResult> taskData) {
        return new ConversationState(Map.of(
                ConversationState.CONVERSATION_ID, "CONV-1",
                ConversationState.TASK_DATA, taskData));
    }

    @SuppressWarnings("unchecked")
    private static TaskResult result(Map<String, Object> update, StageKind kind) {
        return ((Map<StageKind, TaskResult>) update.get(ConversationState.TASK_DATA)).get(kind);
    }

    @Test
    @DisplayName("a worker that already succeeded is not executed again")
    void skipsSucceededWorker() {
        var worker = worker(StageKind.CONTACT);
        var done = TaskResult.success(StageKind.CONTACT, "", "found", List.of(), 1);

        var update = executor.execute(worker, state(Map.of(StageKind.CONTACT, done)));

        verify(worker, never()).execute(any());
        assertFalse(update.containsKey(ConversationState.TASK_DATA));
    }

    @Test
    @DisplayName("compose runs again even after a successful pass")
    void composeAlwaysRuns() {
        var worker = worker(StageKind.COMPOSE);
        var previous = TaskResult.success(StageKind.COMPOSE, "", "Draft composed", List.of(), 1);
        when(worker.execute(any())).thenReturn(StageOutcome.success(
                TaskResult.success(StageKind.COMPOSE, "", "Draft revised", List.of(), 2), "compose: draft revised"));

        var update = executor.execute(worker, state(Map.of(StageKind.COMPOSE, previous)));

        assertEquals("Draft revised", result(update, StageKind.COMPOSE).summary());
        assertEquals(List.of("compose: draft revised"), update.get(ConversationState.MESSAGES));
    }

    @Test
    @DisplayName("an integration failure becomes a FAILED marker with an external service error")
    void integrationFailure() {
        var worker = worker(StageKind.KNOWLEDGE);
        when(worker.execute(any())).thenThrow(new DirectoryException("index offline"));

        var update = executor.execute(worker, state(Map.of()));

        assertEquals(CompletionMarker.FAILED, result(update, StageKind.KNOWLEDGE).marker());
        @SuppressWarnings("unchecked")
        var errors = (List<StageError>) update.get(ConversationState.ERRORS);
        assertEquals(ErrorKind.EXTERNAL_SERVICE, errors.get(0).kind());
        assertNull(update.get(ConversationState.STATUS));
    }

    @Test
    @DisplayName("an unexpected exception is fatal and ends the conversation in ERROR")
    void unexpectedFailure() {
        var worker = worker(StageKind.SCHEDULING);
        when(worker.execute(any())).thenThrow(new NullPointerException("boom"));

        var update = executor.execute(worker, state(Map.of()));

        assertEquals(CompletionMarker.FAILED, result(update, StageKind.SCHEDULING).marker());
        assertEquals(ConversationStatus.ERROR, update.get(ConversationState.STATUS));
        @SuppressWarnings("unchecked")
        var errors = (List<StageError>) update.get(ConversationState.ERRORS);
        assertEquals(ErrorKind.FATAL, errors.get(0).kind());
    }

    @Test
    @DisplayName("every execution is timed with its marker")
    void recordsTimer() {
        var worker = worker(StageKind.CONTACT);
        when(worker.execute(any())).thenReturn(StageOutcome.success(
                TaskResult.success(StageKind.CONTACT, "", "found", List.of(), 1), "contact: found"));

        executor.execute(worker, state(Map.of()));

        var timer = registry.find("inbox.stage.duration").tag("stage", "contact").tag("marker", "SUCCESS").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }
}
