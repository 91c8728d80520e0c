package com.inboxpilot.core.nodes;

import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.ContactDirectory;
import com.inboxpilot.integration.DirectoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Looks up the sender and any people or companies the task mentions in the contact directory.
 */
@Component
public class ContactLookupNode implements StageWorker {

    private static final Logger log = LoggerFactory.getLogger(ContactLookupNode.class);

    private final ContactDirectory contacts;
    private final StageExecutor executor;

    public ContactLookupNode(ContactDirectory contacts, StageExecutor executor) {
        this.contacts = contacts;
        this.executor = executor;
    }

    @Override
    public StageKind kind() {
        return StageKind.CONTACT;
    }

    public Map<String, Object> apply(ConversationState state) {
        return executor.execute(this, state);
    }

    @Override
    public StageOutcome execute(ConversationState state) {
        String task = state.routingPlan().map(plan -> plan.taskFor(StageKind.CONTACT)).orElse("");
        String sender = state.request().map(InboundEmail::sender).orElse("");
        String query = (sender + " " + task).trim();
        try {
            List<DirectoryRecord> hits = contacts.search(query);
            log.info("Contact lookup returned {} record(s)", hits.size());
            String summary = hits.isEmpty() ? "No matching contacts" : hits.size() + " contact record(s) found";
            return StageOutcome.success(
                    TaskResult.success(StageKind.CONTACT, task, summary, hits, state.epoch()),
                    "contact: " + summary);
        } catch (DirectoryException e) {
            log.warn("Contact search failed: {}", e.getMessage());
            return StageOutcome.failure(
                    TaskResult.failed(StageKind.CONTACT, task, "Contact search failed", state.epoch()),
                    StageError.of(StageKind.CONTACT, ErrorKind.EXTERNAL_SERVICE, e.getMessage()));
        }
    }
}
