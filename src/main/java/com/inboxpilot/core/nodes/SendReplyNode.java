package com.inboxpilot.core.nodes;

import com.inboxpilot.core.logging.MdcContext;
import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.persistence.SideEffectLedger;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.MailTransmissionException;
import com.inboxpilot.integration.MailTransmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends the approved draft to the original sender, in the original thread.
 * <p>
 * Guarded by the side-effect ledger under {@code conversationId:epoch:send}: a completed key is
 * never sent again, and a reservation without completion means the outcome is unknown, which is
 * reported as an error instead of risking a second message.
 */
@Component
public class SendReplyNode {

    private static final Logger log = LoggerFactory.getLogger(SendReplyNode.class);

    static final String STAGE = "send";

    private final MailTransmissionService mail;
    private final SideEffectLedger ledger;
    private final InboxMetrics metrics;

    public SendReplyNode(MailTransmissionService mail, SideEffectLedger ledger, InboxMetrics metrics) {
        this.mail = mail;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ConversationState state) {
        MdcContext.setStage(STAGE);
        try {
            return send(state);
        } finally {
            MdcContext.clearStage();
        }
    }

    private Map<String, Object> send(ConversationState state) {
        String key = state.effectKey(STAGE);
        var update = new HashMap<String, Object>();

        var existing = ledger.find(key);
        if (existing.isPresent() && existing.get().state() == SideEffectLedger.State.COMPLETED) {
            log.info("Reply {} already sent as {}; skipping", key, existing.get().result());
            metrics.recordSideEffect(STAGE, "duplicate");
            update.put(ConversationState.STATUS, ConversationStatus.COMPLETED);
            update.put(ConversationState.COMMITTED_EFFECTS, Map.of(key, existing.get().result()));
            update.put(ConversationState.MESSAGES, List.of(STAGE + ": already sent"));
            return update;
        }
        if (existing.isPresent()) {
            log.error("Reply {} was reserved but never completed; delivery outcome unknown", key);
            return error(update, ErrorKind.EXTERNAL_SERVICE, "Delivery outcome unknown for " + key);
        }

        var email = state.request().orElse(null);
        if (email == null || !email.hasSender()) {
            return error(update, ErrorKind.VALIDATION, "No recipient for the reply");
        }
        if (state.draftOutput().isBlank()) {
            return error(update, ErrorKind.VALIDATION, "No draft to send");
        }
        if (!ledger.reserve(key)) {
            metrics.recordSideEffect(STAGE, "duplicate");
            return error(update, ErrorKind.EXTERNAL_SERVICE, "Reply " + key + " is already being sent");
        }

        try {
            String messageId = mail.send(email.sender(), email.replySubject(), state.draftOutput(), email.threadId());
            ledger.complete(key, messageId);
            metrics.recordSideEffect(STAGE, "executed");
            log.info("Reply sent to {} as {}", email.sender(), messageId);
            update.put(ConversationState.STATUS, ConversationStatus.COMPLETED);
            update.put(ConversationState.COMMITTED_EFFECTS, Map.of(key, messageId));
            update.put(ConversationState.MESSAGES, List.of(STAGE + ": reply sent"));
            return update;
        } catch (MailTransmissionException e) {
            ledger.release(key);
            metrics.recordSideEffect(STAGE, "failed");
            log.error("Sending reply {} failed: {}", key, e.getMessage(), e);
            return error(update, ErrorKind.EXTERNAL_SERVICE, "Sending failed: " + e.getMessage());
        }
    }

    private static Map<String, Object> error(Map<String, Object> update, ErrorKind kind, String message) {
        update.put(ConversationState.STATUS, ConversationStatus.ERROR);
        update.put(ConversationState.ERRORS, List.of(new StageError(STAGE, kind, message)));
        update.put(ConversationState.MESSAGES, List.of(STAGE + ": " + message));
        return update;
    }
}
