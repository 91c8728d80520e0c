package com.inboxpilot.core.nodes;

import com.inboxpilot.core.logging.MdcContext;
import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.CompletionMarker;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.IntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link StageWorker} as a graph node.
 * <p>
 * A worker stage whose marker is already SUCCESS is not executed again. Exceptions that escape
 * a worker are converted into a FAILED marker and an error entry, so the router always gets
 * control back. Anything other than an {@link IntegrationException} is FATAL and ends the
 * conversation in ERROR.
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final InboxMetrics metrics;

    public StageExecutor(InboxMetrics metrics) {
        this.metrics = metrics;
    }

    public Map<String, Object> execute(StageWorker worker, ConversationState state) {
        StageKind kind = worker.kind();
        if (kind.isWorker() && state.marker(kind) == CompletionMarker.SUCCESS) {
            log.info("Stage {} already succeeded in this conversation; skipping", kind.wireName());
            return Map.of(ConversationState.MESSAGES, List.of(kind.wireName() + ": already completed, skipped"));
        }

        MdcContext.setStage(kind.wireName());
        long start = System.currentTimeMillis();
        StageOutcome outcome;
        try {
            outcome = worker.execute(state);
        } catch (IntegrationException e) {
            log.warn("Stage {} failed on an external service: {}", kind.wireName(), e.getMessage());
            outcome = failed(kind, state, ErrorKind.EXTERNAL_SERVICE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Stage {} failed unexpectedly", kind.wireName(), e);
            outcome = failed(kind, state, ErrorKind.FATAL, e.getClass().getSimpleName() + ": " + e.getMessage())
                    .with(ConversationState.STATUS, ConversationStatus.ERROR);
        } finally {
            MdcContext.clearStage();
        }
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordStageExecution(kind.wireName(), outcome.result().marker().name(), elapsed);
        log.info("Stage {} finished with {} in {}ms", kind.wireName(), outcome.result().marker(), elapsed);
        return toUpdate(kind, outcome);
    }

    static Map<String, Object> toUpdate(StageKind kind, StageOutcome outcome) {
        var update = new HashMap<String, Object>(outcome.extra());
        update.put(ConversationState.TASK_DATA, Map.of(kind, outcome.result()));
        if (!outcome.errors().isEmpty()) {
            update.put(ConversationState.ERRORS, outcome.errors());
        }
        if (!outcome.messages().isEmpty()) {
            update.put(ConversationState.MESSAGES, outcome.messages());
        }
        return update;
    }

    private static StageOutcome failed(StageKind kind, ConversationState state, ErrorKind errorKind, String message) {
        String task = state.routingPlan().map(plan -> plan.taskFor(kind)).orElse("");
        return StageOutcome.failure(TaskResult.failed(kind, task, message, state.epoch()),
                StageError.of(kind, errorKind, message));
    }
}
