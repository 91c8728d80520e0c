package com.inboxpilot.core.nodes;

import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.DirectoryException;
import com.inboxpilot.integration.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Searches internal documents for facts the reply needs. The query is the router's task for
 * this stage, or the request subject when the plan gave none.
 */
@Component
public class KnowledgeLookupNode implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeLookupNode.class);

    private final DocumentRepository documents;
    private final StageExecutor executor;

    public KnowledgeLookupNode(DocumentRepository documents, StageExecutor executor) {
        this.documents = documents;
        this.executor = executor;
    }

    @Override
    public StageKind kind() {
        return StageKind.KNOWLEDGE;
    }

    public Map<String, Object> apply(ConversationState state) {
        return executor.execute(this, state);
    }

    @Override
    public StageOutcome execute(ConversationState state) {
        String task = state.routingPlan().map(plan -> plan.taskFor(StageKind.KNOWLEDGE)).orElse("");
        String query = task.isBlank()
                ? state.request().map(InboundEmail::subject).orElse("")
                : task;
        try {
            List<DirectoryRecord> hits = documents.search(query);
            log.info("Knowledge lookup for '{}' returned {} document(s)", query, hits.size());
            String summary = hits.isEmpty()
                    ? "No relevant documents found"
                    : hits.size() + " relevant document(s) found";
            return StageOutcome.success(
                    TaskResult.success(StageKind.KNOWLEDGE, task, summary, hits, state.epoch()),
                    "knowledge: " + summary);
        } catch (DirectoryException e) {
            log.warn("Document search failed: {}", e.getMessage());
            return StageOutcome.failure(
                    TaskResult.failed(StageKind.KNOWLEDGE, task, "Document search failed", state.epoch()),
                    StageError.of(StageKind.KNOWLEDGE, ErrorKind.EXTERNAL_SERVICE, e.getMessage()));
        }
    }
}
